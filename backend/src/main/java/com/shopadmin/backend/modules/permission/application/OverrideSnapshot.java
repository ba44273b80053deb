package com.shopadmin.backend.modules.permission.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.UserPermissionOverride;

/**
 * Detached view of a user override. Expiry is evaluated by the reader, so a cached snapshot
 * stops applying at {@code expiresAt} without an eviction.
 */
public record OverrideSnapshot(UUID permissionId, boolean granted, String reason, OffsetDateTime expiresAt) {

    public static OverrideSnapshot of(UserPermissionOverride override) {
        return new OverrideSnapshot(
                override.getPermission().getId(),
                override.isGranted(),
                override.getReason(),
                override.getExpiresAt()
        );
    }

    public boolean isExpired(OffsetDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
