package com.example.authz.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Authenticated identity of the current request.
 *
 * <p>Immutable: guard stages return a new instance carrying the trust flags they
 * computed. {@code siteAdmin == null} means not computed yet and
 * {@code storeRoles == null} means not loaded yet. Neither is ever taken from the
 * credential.
 */
public record Principal(
        String id,
        String email,
        boolean active,
        Boolean siteAdmin,
        List<StoreRoleAssignment> storeRoles,
        Set<PermissionScope> grantedScopes
) {
    public Principal {
        Objects.requireNonNull(id, "id");
        storeRoles = storeRoles == null ? null : List.copyOf(storeRoles);
        grantedScopes = grantedScopes == null ? Set.of() : Set.copyOf(grantedScopes);
    }

    public static Principal authenticated(String id, String email, Set<PermissionScope> grantedScopes) {
        return new Principal(id, email, true, null, null, grantedScopes);
    }

    public Principal withSiteAdmin(boolean siteAdmin) {
        return new Principal(id, email, active, siteAdmin, storeRoles, grantedScopes);
    }

    public Principal withStoreRoles(List<StoreRoleAssignment> storeRoles) {
        return new Principal(id, email, active, siteAdmin, storeRoles, grantedScopes);
    }

    public boolean isSiteAdmin() {
        return Boolean.TRUE.equals(siteAdmin);
    }

    public boolean siteAdminComputed() {
        return siteAdmin != null;
    }

    public boolean storeRolesLoaded() {
        return storeRoles != null;
    }

    public Optional<StoreRole> roleInStore(String storeId) {
        if (storeRoles == null || storeId == null) {
            return Optional.empty();
        }
        return storeRoles.stream()
                .filter(assignment -> assignment.isForStore(storeId))
                .map(StoreRoleAssignment::roleName)
                .findFirst();
    }

    public boolean hasRoleInStore(String storeId, StoreRole role) {
        return roleInStore(storeId).filter(role::equals).isPresent();
    }

    public Set<PermissionScope> missingScopes(Collection<PermissionScope> required) {
        Set<PermissionScope> missing = new LinkedHashSet<>();
        for (PermissionScope scope : required) {
            if (!grantedScopes.contains(scope)) {
                missing.add(scope);
            }
        }
        return missing;
    }
}
