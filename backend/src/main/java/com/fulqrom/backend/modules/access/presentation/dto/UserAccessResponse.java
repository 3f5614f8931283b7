package com.fulqrom.backend.modules.access.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fulqrom.backend.modules.access.domain.AppUser;

public record UserAccessResponse(
        String id,
        String email,
        @JsonProperty("full_name") String fullName,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("deactivated_at") OffsetDateTime deactivatedAt,
        @JsonProperty("deactivated_by") String deactivatedBy,
        List<RoleRef> roles,
        @JsonProperty("resource_access") List<ResourceAccessGrantResponse> resourceAccess
) {

    public static UserAccessResponse from(AppUser user) {
        return new UserAccessResponse(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.isActive(),
                user.getDeactivatedAt(),
                user.getDeactivatedBy(),
                user.getRoles().stream().map(role -> new RoleRef(role.getId(), role.getName())).toList(),
                user.getResourceAccess().stream().map(ResourceAccessGrantResponse::from).toList()
        );
    }

    public record RoleRef(String id, String name) {
    }
}
