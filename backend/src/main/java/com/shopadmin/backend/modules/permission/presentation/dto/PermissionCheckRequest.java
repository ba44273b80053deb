package com.shopadmin.backend.modules.permission.presentation.dto;

import java.util.UUID;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record PermissionCheckRequest(
        @NotNull(message = "userId is required") UUID userId,
        @NotNull(message = "resource is required") ResourceType resource,
        @NotNull(message = "action is required") ActionType action,
        @Size(max = 128) String resourceId
) {
}
