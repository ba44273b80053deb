package com.shopadmin.backend.modules.permission.presentation.dto;

import java.util.List;

import com.shopadmin.backend.modules.permission.application.GrantMutationService.RolePermissionChanges;

public record RolePermissionChangeResponse(List<String> granted, List<String> revoked) {

    public static RolePermissionChangeResponse from(RolePermissionChanges changes) {
        return new RolePermissionChangeResponse(changes.granted(), changes.revoked());
    }
}
