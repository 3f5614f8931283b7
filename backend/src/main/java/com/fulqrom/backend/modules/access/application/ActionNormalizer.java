package com.fulqrom.backend.modules.access.application;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.fulqrom.backend.modules.access.domain.PermissionFlag;

/**
 * Maps action verbs and HTTP methods onto permission flags.
 */
public final class ActionNormalizer {

    private static final Map<String, PermissionFlag> ACTIONS = Map.of(
            "view", PermissionFlag.VIEW,
            "read", PermissionFlag.VIEW,
            "create", PermissionFlag.CREATE,
            "add", PermissionFlag.CREATE,
            "edit", PermissionFlag.EDIT,
            "update", PermissionFlag.EDIT,
            "delete", PermissionFlag.DELETE,
            "remove", PermissionFlag.DELETE
    );

    private static final Map<String, PermissionFlag> HTTP_METHODS = Map.of(
            "GET", PermissionFlag.VIEW,
            "HEAD", PermissionFlag.VIEW,
            "OPTIONS", PermissionFlag.VIEW,
            "POST", PermissionFlag.CREATE,
            "PUT", PermissionFlag.EDIT,
            "PATCH", PermissionFlag.EDIT,
            "DELETE", PermissionFlag.DELETE
    );

    private ActionNormalizer() {
    }

    public static Optional<PermissionFlag> tryNormalize(String action) {
        if (action == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ACTIONS.get(action.trim().toLowerCase(Locale.ROOT)));
    }

    public static PermissionFlag normalize(String action) {
        return tryNormalize(action).orElseThrow(() -> new AuthorizationFailureException(
                AuthorizationFailure.INVALID_ACTION,
                "Invalid action: " + action + ". Must be one of: view, create, edit, delete."
        ));
    }

    /**
     * Unknown methods fall back to view.
     */
    public static PermissionFlag fromHttpMethod(String method) {
        if (method == null) {
            return PermissionFlag.VIEW;
        }
        return HTTP_METHODS.getOrDefault(method.toUpperCase(Locale.ROOT), PermissionFlag.VIEW);
    }
}
