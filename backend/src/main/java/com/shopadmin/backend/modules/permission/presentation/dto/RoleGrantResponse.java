package com.shopadmin.backend.modules.permission.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.domain.RolePermission;

public record RoleGrantResponse(
        UUID permissionId,
        String name,
        ResourceType resource,
        ActionType action,
        boolean active,
        UUID grantedBy,
        OffsetDateTime grantedAt
) {

    public static RoleGrantResponse from(RolePermission grant) {
        Permission permission = grant.getPermission();
        return new RoleGrantResponse(
                permission.getId(),
                permission.getName(),
                permission.getResourceType(),
                permission.getActionType(),
                permission.isActive(),
                grant.getGrantedBy(),
                grant.getGrantedAt()
        );
    }
}
