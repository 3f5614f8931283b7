package com.fulqrom.backend.modules.access.presentation.gate;

import java.util.Optional;

import com.fulqrom.backend.modules.access.application.AuthorizationDecision;
import com.fulqrom.backend.modules.access.application.AuthorizationFailure;
import com.fulqrom.backend.modules.access.application.AuthorizationFailureException;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Hands the granted decision from the gate to the handler and anything running after it.
 */
public final class AuthorizationContext {

    public static final String REQUEST_ATTRIBUTE = AuthorizationContext.class.getName() + ".DECISION";

    private AuthorizationContext() {
    }

    static void store(HttpServletRequest request, AuthorizationDecision decision) {
        request.setAttribute(REQUEST_ATTRIBUTE, decision);
    }

    public static Optional<AuthorizationDecision> current(HttpServletRequest request) {
        Object value = request.getAttribute(REQUEST_ATTRIBUTE);
        return value instanceof AuthorizationDecision decision ? Optional.of(decision) : Optional.empty();
    }

    /**
     * Id of the user the gate authorized. Handlers that act on behalf of the caller need one.
     */
    public static String requireUserId(HttpServletRequest request) {
        return current(request)
                .map(AuthorizationDecision::userId)
                .orElseThrow(() -> new AuthorizationFailureException(AuthorizationFailure.AUTHENTICATION_REQUIRED));
    }
}
