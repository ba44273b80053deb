package com.shopadmin.backend.support;

import java.lang.reflect.Field;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.Permission;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.domain.Role;
import com.shopadmin.backend.modules.permission.domain.UserPermissionOverride;

/**
 * Detached entities for unit tests. Identifiers and the system flag are normally assigned by
 * the database, so they are set reflectively here.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static Permission permission(ResourceType resource, ActionType action) {
        Permission permission = new Permission(resource, action, resource.code() + " " + action.code(), null);
        setField(permission, "id", UUID.randomUUID());
        return permission;
    }

    public static Permission systemPermission(ResourceType resource, ActionType action) {
        Permission permission = permission(resource, action);
        setField(permission, "system", true);
        return permission;
    }

    public static Role role(String code) {
        return new Role(code, code, null);
    }

    public static Role systemRole(String code) {
        Role role = role(code);
        setField(role, "system", true);
        return role;
    }

    public static UserPermissionOverride override(UUID userId, Permission permission, boolean granted,
                                                  String reason, OffsetDateTime expiresAt) {
        UserPermissionOverride override = new UserPermissionOverride(userId, permission);
        override.apply(granted, UUID.randomUUID(), reason, expiresAt);
        setField(override, "id", UUID.randomUUID());
        return override;
    }

    public static void setField(Object target, String name, Object value) {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(name);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalArgumentException("No field " + name + " on " + target.getClass());
    }
}
