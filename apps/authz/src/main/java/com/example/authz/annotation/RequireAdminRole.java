package com.example.authz.annotation;

import com.example.authz.model.AdminRole;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a handler (or every handler of a controller) to site administrators.
 * A store-level role never satisfies this constraint.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequireAdminRole {

    AdminRole value() default AdminRole.ADMIN;
}
