package com.fulqrom.backend.modules.access.presentation.dto;

import jakarta.validation.constraints.NotBlank;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Either {@code module} or {@code resource_type} with {@code resource_id} names the target.
 * Without {@code user_id} the caller's own access is evaluated.
 */
public record AuthorizationCheckRequest(
        @JsonProperty("user_id") String userId,
        @JsonProperty("resource_type") String resourceType,
        @JsonProperty("resource_id") String resourceId,
        String module,
        @NotBlank String action
) {
}
