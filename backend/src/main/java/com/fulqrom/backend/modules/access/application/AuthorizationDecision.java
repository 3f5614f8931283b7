package com.fulqrom.backend.modules.access.application;

import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.domain.ResourceAccessGrant;

/**
 * Outcome of one evaluation. A denial is a regular result, not an error.
 *
 * @param matchedGrant grant that decided the request, only for {@link DecisionSource#RESOURCE_ACCESS}
 * @param roleName     role that granted the request, only for an allowed {@link DecisionSource#ROLE} decision
 * @param resourceType {@code null} for module-level checks
 * @param resourceId   {@code null} for module-level checks
 */
public record AuthorizationDecision(
        boolean allowed,
        DecisionSource source,
        PermissionFlag permission,
        String userId,
        String moduleName,
        String resourceType,
        String resourceId,
        ResourceAccessGrant matchedGrant,
        String roleName
) {

    public static AuthorizationDecision grantedByResourceAccess(
            String userId, PermissionFlag permission, String moduleName, ResourceAccessGrant grant) {
        return new AuthorizationDecision(true, DecisionSource.RESOURCE_ACCESS, permission, userId, moduleName,
                grant.getResourceType(), grant.getResourceId(), grant, null);
    }

    public static AuthorizationDecision deniedByResourceAccess(
            String userId, PermissionFlag permission, String moduleName, ResourceAccessGrant grant) {
        return new AuthorizationDecision(false, DecisionSource.RESOURCE_ACCESS, permission, userId, moduleName,
                grant.getResourceType(), grant.getResourceId(), grant, null);
    }

    public static AuthorizationDecision fromRoles(
            String userId,
            PermissionFlag permission,
            String moduleName,
            String resourceType,
            String resourceId,
            RoleModuleEvaluator.Verdict verdict
    ) {
        return verdict.granted()
                ? new AuthorizationDecision(true, DecisionSource.ROLE, permission, userId, moduleName,
                        resourceType, resourceId, null, verdict.roleName())
                : new AuthorizationDecision(false, DecisionSource.DENIED, permission, userId, moduleName,
                        resourceType, resourceId, null, null);
    }
}
