package com.example.authz.entity;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Criteria-based lookup. The resolver passes {@code {"id": <id>}}.
 */
public interface FindOneLookup<T> {

    Mono<T> findOne(Map<String, Object> where);
}
