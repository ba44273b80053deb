package com.shopadmin.backend.modules.permission.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ReplaceRolePermissionsRequest(
        @NotNull(message = "permissionIds is required") List<@NotNull UUID> permissionIds
) {
}
