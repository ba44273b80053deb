package com.shopadmin.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record LoginResponse(
        AccessTokenResponse tokens,
        UUID userId,
        String loginId,
        String fullName,
        String roleCode
) {
}
