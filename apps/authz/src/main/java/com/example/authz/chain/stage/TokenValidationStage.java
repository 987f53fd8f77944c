package com.example.authz.chain.stage;

import com.example.authz.chain.GuardContext;
import com.example.authz.chain.GuardStage;
import com.example.authz.chain.StageResult;
import com.example.authz.exception.AuthenticationException;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.GuardStageNames;
import com.example.authz.token.TokenValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Authenticates the caller. Every route that reaches the chain needs a valid
 * token for an active account.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenValidationStage implements GuardStage {

    private final TokenValidator tokenValidator;

    @Override
    public String name() {
        return GuardStageNames.TOKEN_VALIDATOR;
    }

    @Override
    public Mono<StageResult> apply(GuardContext context) {
        return tokenValidator.authenticate(context.request().rawCredential())
                .map(principal -> StageResult.proceed(context.withPrincipal(principal)))
                .onErrorResume(AuthenticationException.class, e -> {
                    log.debug("Authentication failed for {}: {}",
                            context.request().route().routeId(), e.getReason());
                    return Mono.just(StageResult.deny(context,
                            AccessDecision.deny(name(), e.getReason(), e.getMessage())));
                });
    }
}
