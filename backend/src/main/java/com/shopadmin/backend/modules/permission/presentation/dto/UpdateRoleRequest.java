package com.shopadmin.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.Size;

public record UpdateRoleRequest(
        @Size(min = 1, max = 100) String displayName,
        @Size(max = 255) String description,
        Boolean active
) {
}
