package com.fulqrom.backend.modules.access.application;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import com.fulqrom.backend.global.common.time.TimeConfig;
import com.fulqrom.backend.global.error.ProblemException;
import com.fulqrom.backend.global.jpa.HexObjectIds;
import com.fulqrom.backend.modules.access.domain.AppUser;
import com.fulqrom.backend.modules.access.domain.PermissionFlags;
import com.fulqrom.backend.modules.access.domain.ResourceAccessGrant;
import com.fulqrom.backend.modules.access.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Grant, update and revoke resource-specific access. The grant list is always replaced as a whole and
 * never holds two grants for the same resource. A grant can only be handed out by someone who can view
 * the resource themselves.
 */
@Service
@Transactional
public class ResourceAccessService {

    private static final Logger log = LoggerFactory.getLogger(ResourceAccessService.class);
    private static final String SYSTEM_ACTOR = "system";

    private final AppUserRepository appUserRepository;
    private final ResourceModuleRegistry resourceModuleRegistry;
    private final AuthorizationService authorizationService;
    private final Clock clock;

    public ResourceAccessService(
            AppUserRepository appUserRepository,
            ResourceModuleRegistry resourceModuleRegistry,
            AuthorizationService authorizationService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.resourceModuleRegistry = resourceModuleRegistry;
        this.authorizationService = authorizationService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<ResourceAccessGrant> listGrants(@NonNull String userId) {
        return findUser(userId).getResourceAccess();
    }

    public ResourceAccessGrant grant(@NonNull GrantCommand command, @NonNull String actorId) {
        String resourceType = requireText(command.resourceType(), "resource_type");
        String resourceId = requireText(command.resourceId(), "resource_id");
        if (!resourceModuleRegistry.resourceTypes().contains(resourceType)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_resource_type",
                    "Invalid resource_type. Must be one of: " + String.join(", ", resourceModuleRegistry.resourceTypes()));
        }

        AppUser user = findUser(command.userId());
        if (!authorizationService.accessScope(actorId, resourceType).covers(resourceId)) {
            log.warn("User {} tried to grant {}/{} outside their own access", actorId, resourceType, resourceId);
            throw new ProblemException(HttpStatus.FORBIDDEN, "access.resource_out_of_scope",
                    "You cannot grant access to " + resourceType + " " + resourceId + " because you cannot view it yourself.");
        }
        if (user.findGrant(resourceType, resourceId).isPresent()) {
            throw new ProblemException(HttpStatus.CONFLICT, "access.grant_duplicate",
                    "Resource access already granted. Use PUT to update permissions.");
        }

        ResourceAccessGrant grant = new ResourceAccessGrant(
                HexObjectIds.next(),
                resourceType,
                resourceId,
                trimToNull(command.resourceName()),
                command.permissions() != null ? command.permissions() : PermissionFlags.viewOnly(),
                TimeConfig.now(clock),
                command.grantedBy() != null && !command.grantedBy().isBlank() ? command.grantedBy().trim() : SYSTEM_ACTOR
        );

        List<ResourceAccessGrant> updated = new ArrayList<>(user.getResourceAccess());
        updated.add(grant);
        user.replaceResourceAccess(updated);
        appUserRepository.save(user);

        log.info("Granted {} on {}/{} to user {} by {}", grant.getPermissions(), resourceType, resourceId,
                user.getId(), grant.getGrantedBy());
        return grant;
    }

    public ResourceAccessGrant updatePermissions(@NonNull String userId, @NonNull String grantId, @NonNull PermissionFlags permissions) {
        AppUser user = findUser(userId);
        ResourceAccessGrant existing = findGrant(user, grantId);
        ResourceAccessGrant replacement = existing.withPermissions(permissions);

        List<ResourceAccessGrant> updated = user.getResourceAccess().stream()
                .map(grant -> grant.getGrantId().equals(grantId) ? replacement : grant)
                .toList();
        user.replaceResourceAccess(updated);
        appUserRepository.save(user);

        log.info("Updated grant {} of user {} to {}", grantId, user.getId(), permissions);
        return replacement;
    }

    public void revoke(@NonNull String userId, @NonNull String grantId) {
        AppUser user = findUser(userId);
        ResourceAccessGrant removed = findGrant(user, grantId);

        List<ResourceAccessGrant> updated = user.getResourceAccess().stream()
                .filter(grant -> !grant.getGrantId().equals(grantId))
                .toList();
        user.replaceResourceAccess(updated);
        appUserRepository.save(user);

        log.info("Revoked grant {} ({}/{}) from user {}", grantId, removed.getResourceType(), removed.getResourceId(), user.getId());
    }

    private AppUser findUser(String userId) {
        if (!HexObjectIds.isValid(userId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access.invalid_user_id", "Invalid user ID format");
        }
        return appUserRepository.findWithAccessById(HexObjectIds.normalize(userId))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.user_not_found", "User not found"));
    }

    private ResourceAccessGrant findGrant(AppUser user, String grantId) {
        return user.findGrantById(grantId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "access.grant_not_found", "Resource access not found"));
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "access." + field + "_required", field + " is required");
        }
        return value.trim();
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record GrantCommand(
            String userId,
            String resourceType,
            String resourceId,
            String resourceName,
            PermissionFlags permissions,
            String grantedBy
    ) {
    }
}
