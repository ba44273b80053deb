package com.shopadmin.backend.modules.permission.presentation.dto;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreatePermissionRequest(
        @NotNull(message = "resource is required") ResourceType resource,
        @NotNull(message = "action is required") ActionType action,
        @NotBlank(message = "displayName is required") @Size(max = 255) String displayName,
        @Size(max = 2000) String description
) {
}
