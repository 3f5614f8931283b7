package com.fulqrom.backend.modules.access.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fulqrom.backend.modules.access.application.AccessScope;

public record AccessScopeResponse(
        @JsonProperty("user_id") String userId,
        @JsonProperty("resource_type") String resourceType,
        String module,
        @JsonProperty("full_access") boolean fullAccess,
        @JsonProperty("resource_ids") List<String> resourceIds,
        @JsonProperty("excluded_resource_ids") List<String> excludedResourceIds
) {

    public static AccessScopeResponse from(AccessScope scope) {
        return new AccessScopeResponse(
                scope.userId(),
                scope.resourceType(),
                scope.moduleName(),
                scope.fullAccess(),
                scope.resourceIds(),
                scope.excludedResourceIds()
        );
    }
}
