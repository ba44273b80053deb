package com.shopadmin.backend.modules.permission.application;

import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

/**
 * Detached, cacheable view of a catalog {@link Permission}.
 */
public record Capability(
        UUID permissionId,
        String name,
        ResourceType resourceType,
        ActionType actionType,
        boolean active,
        boolean system
) {

    public static Capability of(Permission permission) {
        return new Capability(
                permission.getId(),
                permission.getName(),
                permission.getResourceType(),
                permission.getActionType(),
                permission.isActive(),
                permission.isSystem()
        );
    }
}
