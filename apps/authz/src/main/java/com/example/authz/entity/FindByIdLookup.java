package com.example.authz.entity;

import reactor.core.publisher.Mono;

/**
 * Lookup by primary key. Matches the shape of a reactive Spring Data repository.
 */
public interface FindByIdLookup<T> {

    Mono<T> findById(String id);
}
