package com.shopadmin.backend.modules.permission.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

public record PermissionResponse(
        UUID id,
        String name,
        String displayName,
        String description,
        ResourceType resource,
        ActionType action,
        boolean system,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getName(),
                permission.getDisplayName(),
                permission.getDescription(),
                permission.getResourceType(),
                permission.getActionType(),
                permission.isSystem(),
                permission.isActive(),
                permission.getCreatedAt(),
                permission.getUpdatedAt()
        );
    }
}
