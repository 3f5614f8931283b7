package com.fulqrom.backend.modules.access.domain;

import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;

/**
 * Role-wide flags for one module.
 */
@Embeddable
public class ModulePermission {

    @Column(name = "module_name", nullable = false, length = 64)
    private String moduleName;

    @Embedded
    private PermissionFlags flags;

    protected ModulePermission() {
    }

    public ModulePermission(String moduleName, PermissionFlags flags) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
        this.flags = Objects.requireNonNull(flags, "flags");
    }

    public String getModuleName() {
        return moduleName;
    }

    public PermissionFlags getFlags() {
        return flags == null ? PermissionFlags.none() : flags;
    }

    public boolean allows(PermissionFlag flag) {
        return getFlags().allows(flag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModulePermission that)) {
            return false;
        }
        return Objects.equals(moduleName, that.moduleName) && Objects.equals(getFlags(), that.getFlags());
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleName);
    }
}
