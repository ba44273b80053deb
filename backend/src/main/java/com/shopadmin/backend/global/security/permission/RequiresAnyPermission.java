package com.shopadmin.backend.global.security.permission;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Passes when any one of the listed capabilities is allowed. Alternatives are checked in
 * declaration order and checking stops at the first allow.
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresAnyPermission {

    RequiresPermission[] value();
}
