package com.fulqrom.backend.modules.access.application;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.fulqrom.backend.modules.access.domain.AppUser;
import com.fulqrom.backend.modules.access.domain.Role;

/**
 * Ranks the built-in roles from least to most privileged. Roles outside the ladder have no rank.
 */
public final class RoleHierarchy {

    public static final String ADMIN = "Admin";

    static final List<String> LADDER = List.of("Tenants", "Contractor", "Building Manager", "Property Manager", ADMIN);

    private RoleHierarchy() {
    }

    /**
     * Highest-ranked active role held by the user, if any of them is on the ladder.
     */
    public static Optional<String> highestActiveRole(AppUser user) {
        return user.getRoles().stream()
                .filter(Role::isActive)
                .map(Role::getName)
                .filter(LADDER::contains)
                .max(Comparator.comparingInt(LADDER::indexOf));
    }

    /**
     * Admin may hand out any role. Everyone else may only hand out ladder roles strictly below their own.
     */
    public static boolean canAssign(String assignerRole, String targetRole) {
        if (ADMIN.equals(assignerRole)) {
            return true;
        }
        int assigner = LADDER.indexOf(assignerRole);
        int target = LADDER.indexOf(targetRole);
        return assigner >= 0 && target >= 0 && target < assigner;
    }
}
