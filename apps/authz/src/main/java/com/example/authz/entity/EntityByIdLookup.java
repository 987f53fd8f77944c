package com.example.authz.entity;

import reactor.core.publisher.Mono;

/**
 * Preferred lookup kind; tried first by {@link EntityOwnerResolver}.
 */
public interface EntityByIdLookup<T> {

    Mono<T> getEntityById(String id);
}
