package com.example.authz.adapter;

import reactor.core.publisher.Mono;

public interface AdminSource {

    Mono<Boolean> isUserValidAdmin(String userId);
}
