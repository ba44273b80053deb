package com.shopadmin.backend.modules.permission.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.UserPermissionOverride;

public record UserOverrideResponse(
        UUID overrideId,
        UUID userId,
        UUID permissionId,
        String permission,
        boolean granted,
        String reason,
        UUID grantedBy,
        OffsetDateTime expiresAt,
        boolean expired,
        OffsetDateTime updatedAt
) {

    public static UserOverrideResponse from(UserPermissionOverride override, OffsetDateTime now) {
        return new UserOverrideResponse(
                override.getId(),
                override.getUserId(),
                override.getPermission().getId(),
                override.getPermission().getName(),
                override.isGranted(),
                override.getReason(),
                override.getGrantedBy(),
                override.getExpiresAt(),
                override.isExpired(now),
                override.getUpdatedAt()
        );
    }
}
