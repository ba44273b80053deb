package com.shopadmin.backend.global.config;

import com.shopadmin.backend.global.security.permission.PermissionEnforcementInterceptor;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final PermissionEnforcementInterceptor permissionEnforcementInterceptor;

    public WebMvcConfig(PermissionEnforcementInterceptor permissionEnforcementInterceptor) {
        this.permissionEnforcementInterceptor = permissionEnforcementInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(permissionEnforcementInterceptor);
    }
}
