package com.shopadmin.backend.modules.permission.presentation.dto;

public record PermissionStatsResponse(
        long totalPermissions,
        long activePermissions,
        long totalRoles,
        long activeRoles,
        long totalUserOverrides,
        long activeUserOverrides
) {
}
