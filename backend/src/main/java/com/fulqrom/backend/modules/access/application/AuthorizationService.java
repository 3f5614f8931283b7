package com.fulqrom.backend.modules.access.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fulqrom.backend.modules.access.domain.AppUser;
import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.domain.ResourceAccessGrant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Permission resolution: identity, active flag, action, then the resource-specific grant and finally the
 * user's roles. A matching grant decides on its own; roles are consulted only when no grant matches.
 *
 * <p>Failures that are not denials (unknown user, inactive account, bad action, missing resource id) are
 * thrown as {@link AuthorizationFailureException}. Denials are returned.
 */
@Service
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final IdentityResolver identityResolver;
    private final ResourceAccessEvaluator resourceAccessEvaluator;
    private final RoleModuleEvaluator roleModuleEvaluator;
    private final ResourceModuleRegistry resourceModuleRegistry;

    public AuthorizationService(
            IdentityResolver identityResolver,
            ResourceAccessEvaluator resourceAccessEvaluator,
            RoleModuleEvaluator roleModuleEvaluator,
            ResourceModuleRegistry resourceModuleRegistry
    ) {
        this.identityResolver = identityResolver;
        this.resourceAccessEvaluator = resourceAccessEvaluator;
        this.roleModuleEvaluator = roleModuleEvaluator;
        this.resourceModuleRegistry = resourceModuleRegistry;
    }

    public AuthorizationDecision authorizeResource(String userIdentifier, String resourceType, String action, String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new AuthorizationFailureException(AuthorizationFailure.RESOURCE_ID_MISSING);
        }
        AppUser user = loadActiveUser(userIdentifier);
        PermissionFlag flag = ActionNormalizer.normalize(action);
        String moduleName = resourceModuleRegistry.moduleFor(resourceType).orElse(null);

        ResourceAccessEvaluator.Verdict resourceVerdict =
                resourceAccessEvaluator.evaluate(user, resourceType, resourceId, flag);
        AuthorizationDecision decision = switch (resourceVerdict.outcome()) {
            case GRANTED -> AuthorizationDecision.grantedByResourceAccess(
                    user.getId(), flag, moduleName, resourceVerdict.grant());
            case DENIED -> AuthorizationDecision.deniedByResourceAccess(
                    user.getId(), flag, moduleName, resourceVerdict.grant());
            case NO_MATCH -> AuthorizationDecision.fromRoles(
                    user.getId(), flag, moduleName, resourceType, resourceId,
                    roleModuleEvaluator.evaluate(user, moduleName, flag));
        };
        return logged(decision);
    }

    public AuthorizationDecision authorizeModule(String userIdentifier, String moduleName, String action) {
        AppUser user = loadActiveUser(userIdentifier);
        PermissionFlag flag = ActionNormalizer.normalize(action);
        RoleModuleEvaluator.Verdict verdict = roleModuleEvaluator.evaluate(user, moduleName, flag);
        return logged(AuthorizationDecision.fromRoles(user.getId(), flag, moduleName, null, null, verdict));
    }

    public AccessScope accessScope(String userIdentifier, String resourceType) {
        if (resourceType == null || resourceType.isBlank()) {
            throw new AuthorizationFailureException(AuthorizationFailure.RESOURCE_TYPE_MISSING);
        }
        return scopeOf(loadActiveUser(userIdentifier), resourceType);
    }

    /**
     * Same precedence as {@link #authorizeResource}: the first grant per resource id decides, module view
     * covers the rest.
     */
    private AccessScope scopeOf(AppUser user, String resourceType) {
        String moduleName = resourceModuleRegistry.moduleFor(resourceType).orElse(null);
        boolean moduleView = roleModuleEvaluator.evaluate(user, moduleName, PermissionFlag.VIEW).granted();

        Map<String, Boolean> firstMatch = new LinkedHashMap<>();
        for (ResourceAccessGrant grant : user.getResourceAccess()) {
            if (resourceType.equals(grant.getResourceType())) {
                firstMatch.putIfAbsent(grant.getResourceId(), grant.getPermissions().allows(PermissionFlag.VIEW));
            }
        }
        List<String> viewable = new ArrayList<>();
        List<String> withheld = new ArrayList<>();
        firstMatch.forEach((resourceId, canView) -> (canView ? viewable : withheld).add(resourceId));

        return moduleView
                ? new AccessScope(user.getId(), resourceType, moduleName, true, List.of(), withheld)
                : new AccessScope(user.getId(), resourceType, moduleName, false, viewable, List.of());
    }

    private AppUser loadActiveUser(String userIdentifier) {
        AppUser user = identityResolver.resolve(userIdentifier);
        if (!user.isActive()) {
            log.info("Rejected inactive account {}", user.getId());
            throw new AuthorizationFailureException(AuthorizationFailure.ACCOUNT_INACTIVE);
        }
        return user;
    }

    private AuthorizationDecision logged(AuthorizationDecision decision) {
        String target = decision.resourceId() != null
                ? decision.resourceType() + "/" + decision.resourceId()
                : decision.moduleName();
        if (decision.allowed()) {
            log.debug("Granted {} on {} to user {} via {}", decision.permission().action(), target,
                    decision.userId(), decision.source().value());
        } else {
            log.info("Denied {} on {} to user {} ({})", decision.permission().action(), target,
                    decision.userId(), decision.source().value());
        }
        return decision;
    }
}
