package com.example.authz.chain;

import reactor.core.publisher.Mono;

/**
 * One step of the {@link GuardChain}.
 *
 * <p>Implementations must not let expected failures escape as errors; they map
 * them to a deny {@link StageResult}. Anything that still escapes is turned into
 * an internal-error denial by the chain.
 */
public interface GuardStage {

    String name();

    Mono<StageResult> apply(GuardContext context);
}
