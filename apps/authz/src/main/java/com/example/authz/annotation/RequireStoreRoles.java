package com.example.authz.annotation;

import com.example.authz.model.StoreRole;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires the caller to hold one of the given roles (OR logic) in the store
 * addressed by the request. Implies an authenticated caller.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}GetMapping("/stores/{storeId}/orders")
 * {@literal @}RequireStoreRoles({StoreRole.ADMIN, StoreRole.MODERATOR})
 * public Flux&lt;Order&gt; findAllByStore(@PathVariable String storeId) {...}
 * </pre>
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequireStoreRoles {

    StoreRole[] value();

    /**
     * Route parameter carrying the store id. Empty means the configured
     * candidates ({@code app.authz.store-id-params}) are tried in order.
     */
    String storeIdParam() default "";
}
