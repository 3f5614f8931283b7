package com.fulqrom.backend.modules.access.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fulqrom.backend.modules.access.application.AuthorizationDecision;
import com.fulqrom.backend.modules.access.application.DecisionSource;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizationDecisionResponse(
        boolean allowed,
        DecisionSource source,
        @JsonProperty("required_permission") String requiredPermission,
        @JsonProperty("user_id") String userId,
        String module,
        @JsonProperty("resource_type") String resourceType,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("role_name") String roleName,
        @JsonProperty("matched_grant") ResourceAccessGrantResponse matchedGrant
) {

    public static AuthorizationDecisionResponse from(AuthorizationDecision decision) {
        return new AuthorizationDecisionResponse(
                decision.allowed(),
                decision.source(),
                decision.permission().fieldName(),
                decision.userId(),
                decision.moduleName(),
                decision.resourceType(),
                decision.resourceId(),
                decision.roleName(),
                decision.matchedGrant() == null ? null : ResourceAccessGrantResponse.from(decision.matchedGrant())
        );
    }
}
