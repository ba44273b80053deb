package com.shopadmin.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank(message = "code is required")
        @Pattern(regexp = "^[A-Za-z][A-Za-z0-9_]{1,31}$", message = "code must be 2-32 letters, digits or underscores")
        String code,
        @NotBlank(message = "displayName is required") @Size(max = 100) String displayName,
        @Size(max = 255) String description
) {
}
