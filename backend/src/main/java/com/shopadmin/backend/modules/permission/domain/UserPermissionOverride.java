package com.shopadmin.backend.modules.permission.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * Per-user grant or denial of a single permission. Takes precedence over the user's role.
 * An override whose {@code expiresAt} is at or before the evaluation instant is treated as absent.
 */
@Entity
@Table(name = "user_permission_override",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_permission_override", columnNames = {"user_id", "permission_id"}))
public class UserPermissionOverride extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "permission_id", nullable = false, updatable = false)
    private Permission permission;

    @Column(name = "is_granted", nullable = false)
    private boolean granted;

    @Column(name = "granted_by", columnDefinition = "uuid")
    private UUID grantedBy;

    @Column(name = "reason", columnDefinition = "text")
    private String reason;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    protected UserPermissionOverride() {
    }

    public UserPermissionOverride(UUID userId, Permission permission) {
        this.userId = userId;
        this.permission = permission;
    }

    public void apply(boolean granted, UUID grantedBy, String reason, OffsetDateTime expiresAt) {
        this.granted = granted;
        this.grantedBy = grantedBy;
        this.reason = reason;
        this.expiresAt = expiresAt;
    }

    public boolean isExpired(OffsetDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public Permission getPermission() {
        return permission;
    }

    public boolean isGranted() {
        return granted;
    }

    public UUID getGrantedBy() {
        return grantedBy;
    }

    public String getReason() {
        return reason;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }
}
