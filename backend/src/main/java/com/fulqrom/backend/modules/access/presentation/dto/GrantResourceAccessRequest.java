package com.fulqrom.backend.modules.access.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GrantResourceAccessRequest(
        @JsonProperty("user_id") @NotBlank String userId,
        @JsonProperty("resource_type") @NotBlank String resourceType,
        @JsonProperty("resource_id") @NotBlank @Size(max = 128) String resourceId,
        @JsonProperty("resource_name") @Size(max = 255) String resourceName,
        PermissionFlagsPayload permissions,
        @JsonProperty("granted_by") @Size(max = 128) String grantedBy
) {
}
