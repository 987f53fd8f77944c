package com.example.authz.annotation;

import com.example.authz.model.PermissionAction;
import com.example.authz.model.PermissionResource;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares permission scopes required by a handler. Every listed
 * {@code resource:action} pair must be granted (AND logic), unless the caller is
 * a site admin or an admin of the store addressed by the request.
 *
 * <p>Example usage:
 * <pre>
 * {@literal @}PatchMapping("/stores/{storeId}/orders/{id}")
 * {@literal @}RequiresPermission(resource = PermissionResource.ORDERS, actions = PermissionAction.UPDATE)
 * public Mono&lt;Order&gt; update(@PathVariable String storeId, @PathVariable String id) {...}
 * </pre>
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Repeatable(RequiresPermissions.class)
public @interface RequiresPermission {

    PermissionResource resource();

    PermissionAction[] actions();
}
