package com.fulqrom.backend.modules.access.application;

import java.util.Optional;

import com.fulqrom.backend.global.jpa.HexObjectIds;
import com.fulqrom.backend.modules.access.domain.AppUser;
import com.fulqrom.backend.modules.access.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Locates the user behind an opaque identifier. Strategies run in order and stop at the first hit:
 * primary key (24-hex only), identity-provider subject, custom account id. Roles and grants are
 * fetched with the user.
 */
@Component
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final AppUserRepository appUserRepository;

    public IdentityResolver(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    public AppUser resolve(String identifier) {
        return find(identifier).orElseThrow(() -> new AuthorizationFailureException(AuthorizationFailure.USER_NOT_FOUND));
    }

    public Optional<AppUser> find(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new AuthorizationFailureException(AuthorizationFailure.AUTHENTICATION_REQUIRED);
        }
        if (HexObjectIds.isValid(identifier)) {
            Optional<AppUser> byId = findByPrimaryKey(identifier);
            if (byId.isPresent()) {
                return byId;
            }
        }

        Optional<AppUser> bySubject = appUserRepository.findWithAccessByAuth0Id(identifier);
        if (bySubject.isPresent()) {
            return bySubject;
        }

        return appUserRepository.findWithAccessByCustomId(identifier);
    }

    private Optional<AppUser> findByPrimaryKey(String candidate) {
        try {
            return appUserRepository.findWithAccessById(HexObjectIds.normalize(candidate));
        } catch (DataAccessException ex) {
            log.warn("Primary-key lookup failed for identifier {}, trying other strategies: {}", candidate, ex.getMessage());
            return Optional.empty();
        }
    }
}
