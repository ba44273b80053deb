package com.shopadmin.backend.modules.permission.presentation.dto;

/**
 * {@code created} is false when the grant already existed.
 */
public record GrantResultResponse(String roleCode, String permission, boolean created) {
}
