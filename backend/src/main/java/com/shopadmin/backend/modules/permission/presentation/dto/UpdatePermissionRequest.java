package com.shopadmin.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdatePermissionRequest(
        @Size(min = 1, max = 255) String displayName,
        @Size(max = 2000) String description,
        Boolean active
) {
}
