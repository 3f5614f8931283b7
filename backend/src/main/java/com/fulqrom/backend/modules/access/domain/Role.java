package com.fulqrom.backend.modules.access.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fulqrom.backend.global.jpa.AbstractVersionedEntity;
import com.fulqrom.backend.global.jpa.HexObjectIds;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

/**
 * Named bundle of module-level permission flags, referenced by users.
 */
@Entity
@Table(name = "role")
public class Role extends AbstractVersionedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 24)
    private String id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "role_permission", joinColumns = @JoinColumn(name = "role_id"))
    @OrderColumn(name = "position")
    private List<ModulePermission> permissions = new ArrayList<>();

    @PrePersist
    protected void assignId() {
        if (id == null) {
            id = HexObjectIds.next();
        }
    }

    public Optional<ModulePermission> findPermission(String moduleName) {
        return permissions.stream()
                .filter(permission -> permission.getModuleName().equals(moduleName))
                .findFirst();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public List<ModulePermission> getPermissions() {
        return List.copyOf(permissions);
    }

    public void replacePermissions(List<ModulePermission> replacement) {
        permissions.clear();
        permissions.addAll(replacement);
    }
}
