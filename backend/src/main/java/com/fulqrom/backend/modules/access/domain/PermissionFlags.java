package com.fulqrom.backend.modules.access.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Immutable set of the four flags. Shared by {@link ModulePermission} and {@link ResourceAccessGrant}.
 */
@Embeddable
public class PermissionFlags {

    @Column(name = "can_view", nullable = false)
    private boolean canView;

    @Column(name = "can_create", nullable = false)
    private boolean canCreate;

    @Column(name = "can_edit", nullable = false)
    private boolean canEdit;

    @Column(name = "can_delete", nullable = false)
    private boolean canDelete;

    protected PermissionFlags() {
    }

    public PermissionFlags(boolean canView, boolean canCreate, boolean canEdit, boolean canDelete) {
        this.canView = canView;
        this.canCreate = canCreate;
        this.canEdit = canEdit;
        this.canDelete = canDelete;
    }

    public static PermissionFlags none() {
        return new PermissionFlags(false, false, false, false);
    }

    public static PermissionFlags viewOnly() {
        return new PermissionFlags(true, false, false, false);
    }

    public static PermissionFlags all() {
        return new PermissionFlags(true, true, true, true);
    }

    public boolean allows(PermissionFlag flag) {
        return switch (flag) {
            case VIEW -> canView;
            case CREATE -> canCreate;
            case EDIT -> canEdit;
            case DELETE -> canDelete;
        };
    }

    public boolean isCanView() {
        return canView;
    }

    public boolean isCanCreate() {
        return canCreate;
    }

    public boolean isCanEdit() {
        return canEdit;
    }

    public boolean isCanDelete() {
        return canDelete;
    }

    public Map<String, Boolean> asMap() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (PermissionFlag flag : PermissionFlag.values()) {
            flags.put(flag.fieldName(), allows(flag));
        }
        return flags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PermissionFlags that)) {
            return false;
        }
        return canView == that.canView
                && canCreate == that.canCreate
                && canEdit == that.canEdit
                && canDelete == that.canDelete;
    }

    @Override
    public int hashCode() {
        return Objects.hash(canView, canCreate, canEdit, canDelete);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
