package com.shopadmin.backend.modules.permission.presentation.dto;

import java.util.List;

public record RoleDetailResponse(
        RoleResponse role,
        List<RoleGrantResponse> permissions
) {
}
