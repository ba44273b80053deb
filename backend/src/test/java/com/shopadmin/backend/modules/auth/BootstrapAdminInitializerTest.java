package com.shopadmin.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.shopadmin.backend.modules.auth.application.BootstrapAdminInitializer;
import com.shopadmin.backend.modules.auth.domain.AppUser;
import com.shopadmin.backend.modules.auth.domain.AppUserStatus;
import com.shopadmin.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RoleRepository;
import com.shopadmin.backend.support.TestEntities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class BootstrapAdminInitializerTest {

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private RoleRepository roleRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private BootstrapAdminInitializer initializer(String password) {
        return new BootstrapAdminInitializer(appUserRepository, roleRepository, passwordEncoder,
                "admin", password, "admin@example.com");
    }

    @Test
    void withoutConfiguredPasswordNoAccountIsCreated() {
        initializer("").run(new DefaultApplicationArguments());

        verifyNoInteractions(appUserRepository, roleRepository);
    }

    @Test
    void shortPasswordFailsStartup() {
        assertThatThrownBy(() -> initializer("admin123!").run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 12");
    }

    @Test
    void createsSuperAdminWithEncodedConfiguredPassword() {
        when(appUserRepository.findByLoginIdIgnoreCase("admin")).thenReturn(Optional.empty());
        when(roleRepository.findById("SUPER_ADMIN")).thenReturn(Optional.of(TestEntities.systemRole("SUPER_ADMIN")));

        initializer("configured-secret-42").run(new DefaultApplicationArguments());

        ArgumentCaptor<AppUser> captor = ArgumentCaptor.forClass(AppUser.class);
        verify(appUserRepository).save(captor.capture());
        AppUser admin = captor.getValue();
        assertThat(admin.getLoginId()).isEqualTo("admin");
        assertThat(admin.getStatus()).isEqualTo(AppUserStatus.ACTIVE);
        assertThat(admin.getRole().getCode()).isEqualTo("SUPER_ADMIN");
        assertThat(admin.getPasswordHash()).isNotEqualTo("configured-secret-42");
        assertThat(passwordEncoder.matches("configured-secret-42", admin.getPasswordHash())).isTrue();
    }

    @Test
    void existingAccountIsLeftUntouched() {
        when(appUserRepository.findByLoginIdIgnoreCase("admin")).thenReturn(Optional.of(new AppUser()));

        initializer("configured-secret-42").run(new DefaultApplicationArguments());

        verify(appUserRepository, never()).save(any(AppUser.class));
        verifyNoInteractions(roleRepository);
    }
}
