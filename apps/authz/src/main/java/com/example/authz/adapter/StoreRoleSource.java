package com.example.authz.adapter;

import com.example.authz.model.StoreRoleAssignment;
import com.example.authz.model.StoreSummary;
import reactor.core.publisher.Mono;

/**
 * Read-only view of the store domain needed by the guard chain.
 */
public interface StoreRoleSource {

    /**
     * Confirms from the store side that the assignment is still in effect.
     */
    Mono<Boolean> hasUserStoreRole(StoreRoleAssignment assignment);

    /**
     * @return the store, or empty when no store has this id
     */
    Mono<StoreSummary> findStore(String storeId);
}
