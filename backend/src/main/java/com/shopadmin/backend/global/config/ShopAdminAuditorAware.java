package com.shopadmin.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.shopadmin.backend.global.security.JwtAuthenticationPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the administrator performing the current request for JPA auditing.
 * Falls back to {@code Optional.empty()} for migrations, schedulers and anonymous calls.
 */
public class ShopAdminAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof JwtAuthenticationPrincipal jwtPrincipal) {
            return Optional.ofNullable(jwtPrincipal.userId());
        }
        return Optional.empty();
    }
}
