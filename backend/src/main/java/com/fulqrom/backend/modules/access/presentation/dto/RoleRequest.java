package com.fulqrom.backend.modules.access.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fulqrom.backend.modules.access.application.RoleService.RoleCommand;

/**
 * Create and update share this body. On update, absent fields keep their current value.
 */
public record RoleRequest(
        @Size(max = 100) String name,
        @Size(max = 255) String description,
        @JsonProperty("is_active") Boolean active,
        List<@Valid ModulePermissionPayload> permissions
) {

    public RoleCommand toCommand() {
        return new RoleCommand(
                name,
                description,
                active,
                permissions == null ? null : permissions.stream().map(ModulePermissionPayload::toModulePermission).toList()
        );
    }
}
