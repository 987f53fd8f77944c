package com.example.authz.adapter;

import com.example.authz.model.Principal;
import com.example.authz.model.StoreSummary;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Combines the three role sources into the queries the guard stages ask.
 *
 * <p>Each source is a distinct dependency; nothing here falls back from one
 * source to another. Errors from the sources are propagated; the calling stage
 * decides how to fail closed.
 */
@Slf4j
public class RoleAdapters {

    private final UserRoleSource userRoleSource;
    private final StoreRoleSource storeRoleSource;
    private final AdminSource adminSource;

    public RoleAdapters(UserRoleSource userRoleSource, StoreRoleSource storeRoleSource, AdminSource adminSource) {
        this.userRoleSource = Objects.requireNonNull(userRoleSource, "userRoleSource");
        this.storeRoleSource = Objects.requireNonNull(storeRoleSource, "storeRoleSource");
        this.adminSource = Objects.requireNonNull(adminSource, "adminSource");
    }

    public Mono<Boolean> isUserActive(String userId) {
        return userRoleSource.isUserActive(userId)
                .defaultIfEmpty(false);
    }

    /**
     * Site admin only when the admin registry holds a valid admin record AND the
     * user record carries the site-admin flag.
     */
    public Mono<Boolean> isSiteAdmin(String userId) {
        if (userId == null || userId.isBlank()) {
            return Mono.just(false);
        }
        return adminSource.isUserValidAdmin(userId)
                .defaultIfEmpty(false)
                .flatMap(validAdmin -> {
                    if (!validAdmin) {
                        return Mono.just(false);
                    }
                    return userRoleSource.isSiteAdmin(userId).defaultIfEmpty(false);
                });
    }

    /**
     * Loads the principal's store roles unless already loaded. Only assignments
     * that belong to the principal and that the store side confirms are kept.
     */
    public Mono<Principal> withStoreRoles(Principal principal) {
        if (principal.storeRolesLoaded()) {
            return Mono.just(principal);
        }
        return userRoleSource.getUserStoreRoles(principal.id())
                .filter(assignment -> principal.id().equals(assignment.userId()))
                .filterWhen(assignment -> storeRoleSource.hasUserStoreRole(assignment).defaultIfEmpty(false))
                .collectList()
                .doOnNext(roles -> log.debug("Loaded {} confirmed store roles for user {}",
                        roles.size(), principal.id()))
                .map(principal::withStoreRoles);
    }

    public Mono<StoreSummary> findStore(String storeId) {
        return storeRoleSource.findStore(storeId);
    }
}
