package com.example.authz.adapter;

import com.example.authz.model.StoreRoleAssignment;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only view of the user domain needed by the guard chain.
 *
 * <p>Implementations backed by blocking repositories must move the call off the
 * event loop (e.g. {@code subscribeOn(Schedulers.boundedElastic())}).
 */
public interface UserRoleSource {

    /**
     * @return true when the account exists, is active and not deleted
     */
    Mono<Boolean> isUserActive(String userId);

    Mono<Boolean> isSiteAdmin(String userId);

    Flux<StoreRoleAssignment> getUserStoreRoles(String userId);
}
