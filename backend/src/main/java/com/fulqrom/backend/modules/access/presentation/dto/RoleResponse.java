package com.fulqrom.backend.modules.access.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fulqrom.backend.modules.access.application.RoleService.RoleSummary;
import com.fulqrom.backend.modules.access.domain.Role;

public record RoleResponse(
        String id,
        String name,
        String description,
        @JsonProperty("is_active") boolean active,
        List<ModulePermissionPayload> permissions,
        @JsonProperty("user_count") long userCount,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt
) {

    public static RoleResponse from(RoleSummary summary) {
        Role role = summary.role();
        return new RoleResponse(
                role.getId(),
                role.getName(),
                role.getDescription(),
                role.isActive(),
                role.getPermissions().stream().map(ModulePermissionPayload::from).toList(),
                summary.userCount(),
                role.getCreatedAt(),
                role.getUpdatedAt()
        );
    }
}
