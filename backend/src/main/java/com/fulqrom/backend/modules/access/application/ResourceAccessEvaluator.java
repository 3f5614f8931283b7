package com.fulqrom.backend.modules.access.application;

import java.util.Optional;

import com.fulqrom.backend.modules.access.domain.AppUser;
import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.domain.ResourceAccessGrant;

import org.springframework.stereotype.Component;

/**
 * Checks the user's resource-specific grants. A matching grant is authoritative in both directions.
 */
@Component
public class ResourceAccessEvaluator {

    public Verdict evaluate(AppUser user, String resourceType, String resourceId, PermissionFlag flag) {
        Optional<ResourceAccessGrant> match = user.findGrant(resourceType, resourceId);
        if (match.isEmpty()) {
            return Verdict.noMatch();
        }
        ResourceAccessGrant grant = match.get();
        return grant.getPermissions().allows(flag)
                ? new Verdict(Outcome.GRANTED, grant)
                : new Verdict(Outcome.DENIED, grant);
    }

    public enum Outcome {
        GRANTED,
        DENIED,
        NO_MATCH
    }

    public record Verdict(Outcome outcome, ResourceAccessGrant grant) {

        static Verdict noMatch() {
            return new Verdict(Outcome.NO_MATCH, null);
        }
    }
}
