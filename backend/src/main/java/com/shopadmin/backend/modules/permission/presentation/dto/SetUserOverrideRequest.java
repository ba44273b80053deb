package com.shopadmin.backend.modules.permission.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SetUserOverrideRequest(
        @NotNull(message = "granted is required") Boolean granted,
        @Size(max = 500) String reason,
        OffsetDateTime expiresAt
) {
}
