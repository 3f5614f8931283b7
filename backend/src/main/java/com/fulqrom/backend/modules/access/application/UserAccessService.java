package com.fulqrom.backend.modules.access.application;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import com.fulqrom.backend.global.common.time.TimeConfig;
import com.fulqrom.backend.global.error.ProblemException;
import com.fulqrom.backend.global.jpa.HexObjectIds;
import com.fulqrom.backend.modules.access.domain.AppUser;
import com.fulqrom.backend.modules.access.domain.Role;
import com.fulqrom.backend.modules.access.infrastructure.persistence.AppUserRepository;
import com.fulqrom.backend.modules.access.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Role reassignment and deactivation. Deactivation is terminal here; users are never deleted.
 * Role changes are bounded by {@link RoleHierarchy}: nobody hands out a role at or above their own.
 */
@Service
@Transactional
public class UserAccessService {

    private static final Logger log = LoggerFactory.getLogger(UserAccessService.class);

    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final IdentityResolver identityResolver;
    private final Clock clock;

    public UserAccessService(
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            IdentityResolver identityResolver,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    public AppUser assignRoles(@NonNull String userId, @NonNull List<String> roleIds, @NonNull String actorId) {
        AppUser user = findUser(userId);
        String actorRole = RoleHierarchy.highestActiveRole(identityResolver.resolve(actorId)).orElse(null);

        List<Role> roles = new ArrayList<>();
        for (String roleId : new LinkedHashSet<>(roleIds)) {
            if (!HexObjectIds.isValid(roleId)) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "user.invalid_role_id", "Invalid role ID format: " + roleId);
            }
            Role role = roleRepository.findById(HexObjectIds.normalize(roleId))
                    .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "user.role_not_found",
                            "Role with ID " + roleId + " not found"));
            if (!RoleHierarchy.canAssign(actorRole, role.getName())) {
                log.warn("User {} with role {} tried to assign role {} to {}", actorId, actorRole, role.getName(), userId);
                throw new ProblemException(HttpStatus.FORBIDDEN, "user.role_elevation_denied",
                        "You cannot assign role '" + role.getName() + "'. Your role '"
                                + (actorRole == null ? "none" : actorRole) + "' does not have sufficient privileges.");
            }
            roles.add(role);
        }

        user.replaceRoles(roles);
        AppUser saved = appUserRepository.save(user);
        log.info("Assigned roles {} to user {}", roles.stream().map(Role::getName).toList(), saved.getId());
        return saved;
    }

    public AppUser deactivate(@NonNull String userId, String actor) {
        AppUser user = findUser(userId);
        if (!user.isActive()) {
            return user;
        }
        user.deactivate(TimeConfig.now(clock), actor);
        AppUser saved = appUserRepository.save(user);
        log.info("Deactivated user {} by {}", saved.getId(), actor);
        return saved;
    }

    private AppUser findUser(String userId) {
        if (!HexObjectIds.isValid(userId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "user.invalid_id", "Invalid user ID format");
        }
        return appUserRepository.findWithAccessById(HexObjectIds.normalize(userId))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "user.not_found", "User not found"));
    }
}
