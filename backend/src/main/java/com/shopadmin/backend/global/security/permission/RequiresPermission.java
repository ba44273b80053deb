package com.shopadmin.backend.global.security.permission;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;

/**
 * Declares the capability a handler requires. Checked by {@link PermissionEnforcementInterceptor}
 * before the handler runs.
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresPermission {

    ResourceType resource();

    ActionType action();

    /**
     * Name of the path variable, or failing that the request parameter, that identifies the
     * target resource instance. Recorded in the decision audit entry only.
     */
    String resourceIdParam() default "";
}
