package com.shopadmin.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * A {@code null} role code removes the user's role.
 */
public record AssignRoleRequest(@Size(max = 32) String roleCode) {
}
