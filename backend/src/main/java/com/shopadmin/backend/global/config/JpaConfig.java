package com.shopadmin.backend.global.config;

import java.util.UUID;

import com.shopadmin.backend.global.common.time.TimeConfig;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = {
        "com.shopadmin.backend.modules.auth.infrastructure.persistence",
        "com.shopadmin.backend.modules.permission.infrastructure.persistence",
        "com.shopadmin.backend.modules.audit.infrastructure.persistence"
})
@EnableJpaAuditing(auditorAwareRef = "adminAuditorAware", dateTimeProviderRef = TimeConfig.AUDITING_TIME_PROVIDER)
public class JpaConfig {

    @Bean
    public AuditorAware<UUID> adminAuditorAware() {
        return new ShopAdminAuditorAware();
    }
}
