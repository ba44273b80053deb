package com.shopadmin.backend.modules.permission.presentation.dto;

import java.util.UUID;

/**
 * Override counts cover live overrides only; {@code expiredOverrides} counts the rest.
 */
public record UserPermissionStatsResponse(
        UUID userId,
        String roleCode,
        long rolePermissions,
        long overrideGrants,
        long overrideDenies,
        long expiredOverrides,
        long effectivePermissions
) {
}
