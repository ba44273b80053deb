package com.shopadmin.backend.support;

import java.util.UUID;

import com.shopadmin.backend.modules.auth.application.JwtTokenService;
import com.shopadmin.backend.modules.auth.domain.AppUser;
import com.shopadmin.backend.modules.auth.domain.AppUserStatus;
import com.shopadmin.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shopadmin.backend.modules.permission.domain.Role;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RoleRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates uniquely named users and roles so integration tests never collide on shared data.
 */
@Component
@Transactional
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "secret123!";

    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public TestUserFactory(
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public AppUser createUser(String loginPrefix, String roleCode) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        AppUser user = new AppUser();
        user.setLoginId(loginPrefix + "-" + suffix);
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        user.setFullName("Test " + loginPrefix);
        user.setEmail(loginPrefix + "-" + suffix + "@example.com");
        user.setStatus(AppUserStatus.ACTIVE);
        if (roleCode != null) {
            user.setRole(roleRepository.findById(roleCode).orElseThrow());
        }
        return appUserRepository.save(user);
    }

    public String createRole(String prefix) {
        String code = prefix + "_" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        roleRepository.save(new Role(code, "Test role " + code, null));
        return code;
    }

    public String tokenFor(AppUser user) {
        String roleCode = user.getRole() != null ? user.getRole().getCode() : null;
        return jwtTokenService.issueAccessToken(user.getId(), user.getLoginId(), roleCode).accessToken();
    }
}
