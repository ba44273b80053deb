package com.shopadmin.backend.modules.auth.application;

import com.shopadmin.backend.modules.auth.domain.AppUser;
import com.shopadmin.backend.modules.auth.domain.AppUserStatus;
import com.shopadmin.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shopadmin.backend.modules.permission.domain.Role;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates the first SUPER_ADMIN account from {@code app.bootstrap.admin.*} when no account with that
 * login exists yet. Without a configured password nothing is created, so a fresh database never
 * carries a known credential.
 */
@Component
public class BootstrapAdminInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminInitializer.class);

    static final String SUPER_ADMIN_ROLE = "SUPER_ADMIN";
    static final int MIN_PASSWORD_LENGTH = 12;

    private final AppUserRepository appUserRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;
    private final String loginId;
    private final String password;
    private final String email;

    public BootstrapAdminInitializer(
            AppUserRepository appUserRepository,
            RoleRepository roleRepository,
            PasswordEncoder passwordEncoder,
            @Value("${app.bootstrap.admin.login-id:admin}") String loginId,
            @Value("${app.bootstrap.admin.password:}") String password,
            @Value("${app.bootstrap.admin.email:admin@shopadmin.dev}") String email
    ) {
        this.appUserRepository = appUserRepository;
        this.roleRepository = roleRepository;
        this.passwordEncoder = passwordEncoder;
        this.loginId = loginId;
        this.password = password;
        this.email = email;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(password)) {
            log.info("No bootstrap administrator password configured, skipping administrator bootstrap");
            return;
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalStateException("app.bootstrap.admin.password must be at least "
                    + MIN_PASSWORD_LENGTH + " characters");
        }
        if (appUserRepository.findByLoginIdIgnoreCase(loginId).isPresent()) {
            log.debug("Bootstrap administrator {} already exists", loginId);
            return;
        }
        Role superAdmin = roleRepository.findById(SUPER_ADMIN_ROLE)
                .orElseThrow(() -> new IllegalStateException("Role " + SUPER_ADMIN_ROLE + " is not seeded"));

        AppUser admin = new AppUser();
        admin.setLoginId(loginId);
        admin.setPasswordHash(passwordEncoder.encode(password));
        admin.setFullName("System Administrator");
        admin.setEmail(email);
        admin.setStatus(AppUserStatus.ACTIVE);
        admin.setRole(superAdmin);
        appUserRepository.save(admin);
        log.warn("Bootstrap administrator {} created; rotate BOOTSTRAP_ADMIN_PASSWORD after first login", loginId);
    }
}
