package com.fulqrom.backend.modules.access.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fulqrom.backend.modules.access.domain.PermissionFlags;

public record PermissionFlagsPayload(
        @JsonProperty("can_view") Boolean canView,
        @JsonProperty("can_create") Boolean canCreate,
        @JsonProperty("can_edit") Boolean canEdit,
        @JsonProperty("can_delete") Boolean canDelete
) {

    public static PermissionFlagsPayload from(PermissionFlags flags) {
        return new PermissionFlagsPayload(flags.isCanView(), flags.isCanCreate(), flags.isCanEdit(), flags.isCanDelete());
    }

    /**
     * Missing flags are false.
     */
    public PermissionFlags toFlags() {
        return new PermissionFlags(
                Boolean.TRUE.equals(canView),
                Boolean.TRUE.equals(canCreate),
                Boolean.TRUE.equals(canEdit),
                Boolean.TRUE.equals(canDelete)
        );
    }
}
