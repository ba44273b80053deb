package com.shopadmin.backend.global.security;

import java.util.UUID;

/**
 * Authenticated administrator. {@code roleCode} reflects the role at token issue time and is
 * informational only; permission checks always read the current role assignment.
 */
public record JwtAuthenticationPrincipal(UUID userId, String loginId, String roleCode) {
}
