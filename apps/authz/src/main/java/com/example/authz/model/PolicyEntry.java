package com.example.authz.model;

import lombok.Builder;

import java.util.Set;

/**
 * Minimum trust required for one route. A missing (null or empty) field means
 * "no constraint of that kind".
 *
 * <p>{@code requireAuthenticated} stays a nullable {@link Boolean} so that merging
 * an override can tell "not specified" apart from "explicitly false".
 */
@Builder(toBuilder = true)
public record PolicyEntry(
        AdminRole adminRole,
        Set<StoreRole> storeRoles,
        Boolean requireAuthenticated,
        String storeIdParam,
        Set<PermissionScope> requiredScopes,
        EntityOwnerConfig entityOwner
) {
    private static final PolicyEntry AUTHENTICATED_ONLY = PolicyEntry.builder()
            .requireAuthenticated(true)
            .build();

    public PolicyEntry {
        storeRoles = storeRoles == null ? Set.of() : Set.copyOf(storeRoles);
        requiredScopes = requiredScopes == null ? Set.of() : Set.copyOf(requiredScopes);
        if (storeIdParam != null && storeIdParam.isBlank()) {
            storeIdParam = null;
        }
    }

    public static PolicyEntry authenticatedOnly() {
        return AUTHENTICATED_ONLY;
    }

    public boolean hasAdminConstraint() {
        return adminRole != null;
    }

    public boolean hasStoreRoleConstraint() {
        return !storeRoles.isEmpty();
    }

    public boolean requiresAuthentication() {
        return Boolean.TRUE.equals(requireAuthenticated);
    }

    public boolean hasScopeConstraint() {
        return !requiredScopes.isEmpty();
    }

    public boolean hasOwnershipConstraint() {
        return entityOwner != null;
    }

    public boolean isUnconstrained() {
        return !hasAdminConstraint()
                && !hasStoreRoleConstraint()
                && !requiresAuthentication()
                && !hasScopeConstraint()
                && !hasOwnershipConstraint();
    }

    // Only requireAuthenticated is set.
    public boolean isAuthenticationOnly() {
        return requiresAuthentication()
                && !hasAdminConstraint()
                && !hasStoreRoleConstraint()
                && !hasScopeConstraint()
                && !hasOwnershipConstraint();
    }

    /**
     * Returns a new entry where every constraint kind present in {@code override}
     * replaces the one in this entry.
     */
    public PolicyEntry overrideWith(PolicyEntry override) {
        if (override == null) {
            return this;
        }
        return new PolicyEntry(
                override.adminRole != null ? override.adminRole : adminRole,
                override.hasStoreRoleConstraint() ? override.storeRoles : storeRoles,
                override.requireAuthenticated != null ? override.requireAuthenticated : requireAuthenticated,
                override.storeIdParam != null ? override.storeIdParam : storeIdParam,
                override.hasScopeConstraint() ? override.requiredScopes : requiredScopes,
                override.entityOwner != null ? override.entityOwner : entityOwner
        );
    }
}
