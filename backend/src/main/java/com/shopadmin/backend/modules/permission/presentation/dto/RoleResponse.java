package com.shopadmin.backend.modules.permission.presentation.dto;

import java.time.OffsetDateTime;

import com.shopadmin.backend.modules.permission.domain.Role;

public record RoleResponse(
        String code,
        String displayName,
        String description,
        boolean system,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(
                role.getCode(),
                role.getDisplayName(),
                role.getDescription(),
                role.isSystem(),
                role.isActive(),
                role.getCreatedAt(),
                role.getUpdatedAt()
        );
    }
}
