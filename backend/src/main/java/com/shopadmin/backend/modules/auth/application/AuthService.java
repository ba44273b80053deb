package com.shopadmin.backend.modules.auth.application;

import com.shopadmin.backend.global.error.ProblemException;
import com.shopadmin.backend.modules.auth.domain.AppUser;
import com.shopadmin.backend.modules.auth.domain.AppUserStatus;
import com.shopadmin.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shopadmin.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.shopadmin.backend.modules.auth.presentation.dto.LoginRequest;
import com.shopadmin.backend.modules.auth.presentation.dto.LoginResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByLoginIdIgnoreCase(request.loginId())
                .orElseThrow(AuthService::invalidCredentials);

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw invalidCredentials();
        }

        if (user.getStatus() != AppUserStatus.ACTIVE) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "user_inactive", "Account is deactivated");
        }

        String roleCode = user.getRole() != null ? user.getRole().getCode() : null;
        AccessTokenResponse tokens = jwtTokenService.issueAccessToken(user.getId(), user.getLoginId(), roleCode);
        log.info("Issued access token userId={} role={}", user.getId(), roleCode);

        return new LoginResponse(tokens, user.getId(), user.getLoginId(), user.getFullName(), roleCode);
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "invalid_credentials", "Login ID or password is incorrect");
    }
}
