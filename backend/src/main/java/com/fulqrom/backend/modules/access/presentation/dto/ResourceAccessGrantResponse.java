package com.fulqrom.backend.modules.access.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fulqrom.backend.modules.access.domain.ResourceAccessGrant;

public record ResourceAccessGrantResponse(
        @JsonProperty("grant_id") String grantId,
        @JsonProperty("resource_type") String resourceType,
        @JsonProperty("resource_id") String resourceId,
        @JsonProperty("resource_name") String resourceName,
        PermissionFlagsPayload permissions,
        @JsonProperty("granted_at") OffsetDateTime grantedAt,
        @JsonProperty("granted_by") String grantedBy
) {

    public static ResourceAccessGrantResponse from(ResourceAccessGrant grant) {
        return new ResourceAccessGrantResponse(
                grant.getGrantId(),
                grant.getResourceType(),
                grant.getResourceId(),
                grant.getResourceName(),
                PermissionFlagsPayload.from(grant.getPermissions()),
                grant.getGrantedAt(),
                grant.getGrantedBy()
        );
    }
}
