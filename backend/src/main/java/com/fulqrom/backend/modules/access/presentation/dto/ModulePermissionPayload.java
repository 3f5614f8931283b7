package com.fulqrom.backend.modules.access.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fulqrom.backend.modules.access.domain.ModulePermission;
import com.fulqrom.backend.modules.access.domain.PermissionFlags;

public record ModulePermissionPayload(
        @JsonProperty("module_name") @NotBlank @Size(max = 64) String moduleName,
        @JsonProperty("can_view") Boolean canView,
        @JsonProperty("can_create") Boolean canCreate,
        @JsonProperty("can_edit") Boolean canEdit,
        @JsonProperty("can_delete") Boolean canDelete
) {

    public static ModulePermissionPayload from(ModulePermission permission) {
        PermissionFlags flags = permission.getFlags();
        return new ModulePermissionPayload(permission.getModuleName(), flags.isCanView(), flags.isCanCreate(),
                flags.isCanEdit(), flags.isCanDelete());
    }

    public ModulePermission toModulePermission() {
        return new ModulePermission(moduleName.trim(), new PermissionFlags(
                Boolean.TRUE.equals(canView),
                Boolean.TRUE.equals(canCreate),
                Boolean.TRUE.equals(canEdit),
                Boolean.TRUE.equals(canDelete)
        ));
    }
}
