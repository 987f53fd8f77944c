package com.example.authz.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a handler to the owner of the addressed entity (or a site admin, or
 * an admin of the store owning the entity).
 *
 * <p>{@link #lookup()} names a collaborator registered in the
 * {@link com.example.authz.entity.EntityLookupRegistry}.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EntityOwner {

    String lookup();

    String idParam() default "id";

    boolean allowMissingEntity() default false;
}
