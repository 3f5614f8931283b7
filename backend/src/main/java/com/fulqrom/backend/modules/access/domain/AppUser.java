package com.fulqrom.backend.modules.access.domain;

import java.time.OffsetDateTime;
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
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

/**
 * Platform user: identity columns, active flag, ordered role references and resource-access grants.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractVersionedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 24)
    private String id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "full_name", nullable = false, length = 200)
    private String fullName;

    @Column(name = "auth0_id", unique = true, length = 128)
    private String auth0Id;

    @Column(name = "custom_id", unique = true, length = 128)
    private String customId;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    @Column(name = "deactivated_by", length = 128)
    private String deactivatedBy;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "user_role",
            joinColumns = @JoinColumn(name = "user_id"),
            inverseJoinColumns = @JoinColumn(name = "role_id")
    )
    @OrderColumn(name = "position")
    private List<Role> roles = new ArrayList<>();

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "user_resource_access", joinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "position")
    private List<ResourceAccessGrant> resourceAccess = new ArrayList<>();

    @PrePersist
    protected void assignId() {
        if (id == null) {
            id = HexObjectIds.next();
        }
    }

    public Optional<ResourceAccessGrant> findGrant(String resourceType, String resourceId) {
        return resourceAccess.stream()
                .filter(grant -> grant.targets(resourceType, resourceId))
                .findFirst();
    }

    public Optional<ResourceAccessGrant> findGrantById(String grantId) {
        return resourceAccess.stream()
                .filter(grant -> grant.getGrantId().equals(grantId))
                .findFirst();
    }

    public void replaceResourceAccess(List<ResourceAccessGrant> replacement) {
        resourceAccess.clear();
        resourceAccess.addAll(replacement);
    }

    public void replaceRoles(List<Role> replacement) {
        roles.clear();
        roles.addAll(replacement);
    }

    public void deactivate(OffsetDateTime at, String by) {
        this.active = false;
        this.deactivatedAt = at;
        this.deactivatedBy = by;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getAuth0Id() {
        return auth0Id;
    }

    public void setAuth0Id(String auth0Id) {
        this.auth0Id = auth0Id;
    }

    public String getCustomId() {
        return customId;
    }

    public void setCustomId(String customId) {
        this.customId = customId;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }

    public String getDeactivatedBy() {
        return deactivatedBy;
    }

    public List<Role> getRoles() {
        return List.copyOf(roles);
    }

    public List<ResourceAccessGrant> getResourceAccess() {
        return List.copyOf(resourceAccess);
    }
}
