package com.fulqrom.backend.modules.access.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateResourceAccessRequest(
        @NotNull PermissionFlagsPayload permissions
) {
}
