package com.shopadmin.backend.global.security.permission;

import java.util.Objects;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

public record PermissionRequirement(ResourceType resource, ActionType action, String resourceId) {

    public PermissionRequirement {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(action, "action");
    }

    public static PermissionRequirement of(ResourceType resource, ActionType action) {
        return new PermissionRequirement(resource, action, null);
    }

    public String name() {
        return Permission.nameOf(resource, action);
    }
}
