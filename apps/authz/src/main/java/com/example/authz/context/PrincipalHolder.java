package com.example.authz.context;

import com.example.authz.exception.AuthenticationException;
import com.example.authz.model.DenialReason;
import com.example.authz.model.Principal;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

/**
 * Access to the principal the guard chain authorized, from the Reactor context
 * of the request. Only a fully evaluated, allowed chain writes it.
 */
public final class PrincipalHolder {

    private static final String PRINCIPAL_KEY = PrincipalHolder.class.getName() + ".PRINCIPAL";

    private PrincipalHolder() {
        // Utility class
    }

    public static Mono<Principal> getPrincipal() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(PRINCIPAL_KEY)) {
                return Mono.just(ctx.get(PRINCIPAL_KEY));
            }
            return Mono.error(new AuthenticationException(
                    DenialReason.MISSING_CREDENTIAL, "No principal found in reactive context"));
        });
    }

    public static Mono<Principal> getPrincipalIfPresent() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(PRINCIPAL_KEY)) {
                return Mono.just(ctx.get(PRINCIPAL_KEY));
            }
            return Mono.empty();
        });
    }

    public static Function<Context, Context> withPrincipal(Principal principal) {
        return context -> context.put(PRINCIPAL_KEY, principal);
    }

    public static Mono<Boolean> hasPrincipal() {
        return Mono.deferContextual(ctx -> Mono.just(ctx.hasKey(PRINCIPAL_KEY)));
    }
}
