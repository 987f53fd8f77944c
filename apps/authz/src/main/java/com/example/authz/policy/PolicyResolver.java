package com.example.authz.policy;

import com.example.authz.annotation.EntityOwner;
import com.example.authz.annotation.RequireAdminRole;
import com.example.authz.annotation.RequireAuthenticated;
import com.example.authz.annotation.RequireStoreRoles;
import com.example.authz.annotation.RequiresPermission;
import com.example.authz.model.EntityOwnerConfig;
import com.example.authz.model.PermissionAction;
import com.example.authz.model.PermissionScope;
import com.example.authz.model.PolicyEntry;
import com.example.authz.model.StoreRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.lang.Nullable;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Produces the effective {@link PolicyEntry} of a route.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>policy annotations on the handler method, then on the controller class (method wins per constraint kind)</li>
 *   <li>the concrete controller's {@link AccessPolicyTable} entry for the handler name</li>
 * </ol>
 * Annotations win over the table per constraint kind. Declaring store roles via
 * annotation implies an authenticated caller.
 *
 * <p>Only annotation metadata is cached, keyed by concrete controller class and
 * handler method. The table is always read from the controller instance handling
 * the request, so controllers sharing a base class never see each other's entries.
 */
@Slf4j
public class PolicyResolver {

    private final Map<MetadataKey, Optional<PolicyEntry>> metadataCache = new ConcurrentHashMap<>();

    /**
     * @return the effective policy, or null when the route declares no constraint
     */
    @Nullable
    public PolicyEntry resolve(RouteDescriptor route) {
        PolicyEntry metadata = metadataCache
                .computeIfAbsent(new MetadataKey(route.controllerType(), route.handler()),
                        key -> Optional.ofNullable(readMetadata(key.controllerType(), key.handler())))
                .orElse(null);
        PolicyEntry tableEntry = findTableEntry(route);

        PolicyEntry merged;
        if (tableEntry == null) {
            merged = metadata;
        } else {
            merged = tableEntry.overrideWith(metadata);
        }

        if (merged == null || merged.isUnconstrained()) {
            log.trace("No policy for {}", route.routeId());
            return null;
        }
        if (merged.isAuthenticationOnly()) {
            return PolicyEntry.authenticatedOnly();
        }
        log.trace("Resolved policy for {}: {}", route.routeId(), merged);
        return merged;
    }

    @Nullable
    private PolicyEntry findTableEntry(RouteDescriptor route) {
        if (!(route.controller() instanceof AccessPolicyAware aware)) {
            return null;
        }
        AccessPolicyTable table = aware.accessPolicies();
        if (table == null) {
            return null;
        }
        return table.find(route.handlerName()).orElse(null);
    }

    @Nullable
    private PolicyEntry readMetadata(Class<?> controllerType, Method handler) {
        PolicyEntry fromClass = readAnnotations(controllerType);
        PolicyEntry fromMethod = readAnnotations(handler);
        if (fromClass == null) {
            return fromMethod;
        }
        return fromClass.overrideWith(fromMethod);
    }

    @Nullable
    private PolicyEntry readAnnotations(AnnotatedElement element) {
        PolicyEntry.PolicyEntryBuilder builder = PolicyEntry.builder();
        boolean found = false;

        RequireAdminRole adminRole = AnnotatedElementUtils.findMergedAnnotation(element, RequireAdminRole.class);
        if (adminRole != null) {
            builder.adminRole(adminRole.value());
            found = true;
        }

        if (AnnotatedElementUtils.hasAnnotation(element, RequireAuthenticated.class)) {
            builder.requireAuthenticated(true);
            found = true;
        }

        RequireStoreRoles storeRoles = AnnotatedElementUtils.findMergedAnnotation(element, RequireStoreRoles.class);
        if (storeRoles != null && storeRoles.value().length > 0) {
            Set<StoreRole> roles = EnumSet.noneOf(StoreRole.class);
            roles.addAll(Arrays.asList(storeRoles.value()));
            builder.storeRoles(roles)
                    .requireAuthenticated(true)
                    .storeIdParam(storeRoles.storeIdParam());
            found = true;
        }

        Set<RequiresPermission> permissions =
                AnnotatedElementUtils.findMergedRepeatableAnnotations(element, RequiresPermission.class);
        if (!permissions.isEmpty()) {
            Set<PermissionScope> scopes = new LinkedHashSet<>();
            for (RequiresPermission permission : permissions) {
                for (PermissionAction action : permission.actions()) {
                    scopes.add(PermissionScope.of(permission.resource(), action));
                }
            }
            builder.requiredScopes(scopes);
            found = true;
        }

        EntityOwner entityOwner = AnnotatedElementUtils.findMergedAnnotation(element, EntityOwner.class);
        if (entityOwner != null) {
            builder.entityOwner(new EntityOwnerConfig(
                    entityOwner.lookup(), entityOwner.idParam(), entityOwner.allowMissingEntity()));
            found = true;
        }

        return found ? builder.build() : null;
    }

    private record MetadataKey(Class<?> controllerType, Method handler) {
    }
}
