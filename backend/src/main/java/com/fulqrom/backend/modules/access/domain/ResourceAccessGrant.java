package com.fulqrom.backend.modules.access.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;

/**
 * Per-user override of the permission flags on exactly one resource instance. Owned by {@link AppUser};
 * treated as a value, replaced rather than mutated.
 */
@Embeddable
public class ResourceAccessGrant {

    @Column(name = "grant_id", nullable = false, length = 24)
    private String grantId;

    @Column(name = "resource_type", nullable = false, length = 32)
    private String resourceType;

    @Column(name = "resource_id", nullable = false, length = 128)
    private String resourceId;

    @Column(name = "resource_name", length = 255)
    private String resourceName;

    @Embedded
    private PermissionFlags permissions;

    @Column(name = "granted_at", nullable = false)
    private OffsetDateTime grantedAt;

    @Column(name = "granted_by", length = 128)
    private String grantedBy;

    protected ResourceAccessGrant() {
    }

    public ResourceAccessGrant(
            String grantId,
            String resourceType,
            String resourceId,
            String resourceName,
            PermissionFlags permissions,
            OffsetDateTime grantedAt,
            String grantedBy
    ) {
        this.grantId = Objects.requireNonNull(grantId, "grantId");
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
        this.resourceName = resourceName;
        this.permissions = Objects.requireNonNull(permissions, "permissions");
        this.grantedAt = Objects.requireNonNull(grantedAt, "grantedAt");
        this.grantedBy = grantedBy;
    }

    public boolean targets(String type, String id) {
        return resourceType.equals(type) && resourceId.equals(id);
    }

    public ResourceAccessGrant withPermissions(PermissionFlags replacement) {
        return new ResourceAccessGrant(grantId, resourceType, resourceId, resourceName, replacement, grantedAt, grantedBy);
    }

    public String getGrantId() {
        return grantId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getResourceName() {
        return resourceName;
    }

    public PermissionFlags getPermissions() {
        return permissions == null ? PermissionFlags.none() : permissions;
    }

    public OffsetDateTime getGrantedAt() {
        return grantedAt;
    }

    public String getGrantedBy() {
        return grantedBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceAccessGrant that)) {
            return false;
        }
        return Objects.equals(grantId, that.grantId)
                && Objects.equals(resourceType, that.resourceType)
                && Objects.equals(resourceId, that.resourceId)
                && Objects.equals(resourceName, that.resourceName)
                && Objects.equals(getPermissions(), that.getPermissions())
                && Objects.equals(grantedAt, that.grantedAt)
                && Objects.equals(grantedBy, that.grantedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(grantId, resourceType, resourceId);
    }
}
