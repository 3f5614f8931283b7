package com.fulqrom.backend.modules.access.application;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fulqrom.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Raised by the HTTP gate for a negative {@link AuthorizationDecision}.
 */
public class PermissionDeniedException extends ProblemException {

    public static final String CODE = "authz.permission_denied";

    private final transient AuthorizationDecision decision;

    public PermissionDeniedException(AuthorizationDecision decision) {
        super(HttpStatus.FORBIDDEN, CODE, describe(decision), detailsOf(decision));
        this.decision = decision;
    }

    public AuthorizationDecision getDecision() {
        return decision;
    }

    private static String describe(AuthorizationDecision decision) {
        String action = decision.permission().action();
        if (decision.source() == DecisionSource.RESOURCE_ACCESS) {
            return "Access denied. You don't have " + action + " permission for this " + decision.resourceType() + ".";
        }
        if (decision.resourceId() != null) {
            return "Access denied. You don't have access to this " + decision.resourceType() + ".";
        }
        return "Access denied. You don't have " + action + " permission for " + decision.moduleName() + ".";
    }

    private static Map<String, Object> detailsOf(AuthorizationDecision decision) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", decision.source().value());
        if (decision.resourceId() != null) {
            details.put("resource_type", decision.resourceType());
            details.put("resource_id", decision.resourceId());
            details.put("required_permission", decision.permission().action());
        } else {
            details.put("required_permission", decision.permission().action() + ":" + decision.moduleName());
        }
        if (decision.source() == DecisionSource.RESOURCE_ACCESS && decision.matchedGrant() != null) {
            details.put("your_permissions", decision.matchedGrant().getPermissions().asMap());
        }
        return details;
    }
}
