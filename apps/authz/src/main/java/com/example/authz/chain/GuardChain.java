package com.example.authz.chain;

import com.example.authz.chain.stage.EntityOwnershipStage;
import com.example.authz.chain.stage.PermissionStage;
import com.example.authz.chain.stage.SiteAdminStage;
import com.example.authz.chain.stage.StoreRoleStage;
import com.example.authz.chain.stage.TokenValidationStage;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.DenialReason;
import com.example.authz.model.GuardStageNames;
import com.example.authz.model.PolicyEntry;
import com.example.authz.policy.PolicyResolver;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs the authorization stages for one request, strictly in order, stopping at
 * the first denial:
 * <ol>
 *   <li>{@link TokenValidationStage}</li>
 *   <li>{@link SiteAdminStage}</li>
 *   <li>{@link StoreRoleStage}</li>
 *   <li>{@link EntityOwnershipStage}</li>
 *   <li>{@link PermissionStage}</li>
 * </ol>
 * The returned {@link Mono} never errors: a stage failure becomes a forbidden
 * {@link DenialReason#INTERNAL_ERROR} decision.
 */
@Slf4j
public class GuardChain {

    private final PolicyResolver policyResolver;
    private final List<GuardStage> stages;

    public GuardChain(PolicyResolver policyResolver,
                      TokenValidationStage tokenValidation,
                      SiteAdminStage siteAdmin,
                      StoreRoleStage storeRole,
                      EntityOwnershipStage entityOwnership,
                      PermissionStage permission) {
        this(policyResolver, List.of(tokenValidation, siteAdmin, storeRole, entityOwnership, permission));
    }

    GuardChain(PolicyResolver policyResolver, List<GuardStage> stages) {
        this.policyResolver = policyResolver;
        this.stages = List.copyOf(stages);
    }

    public Mono<GuardOutcome> evaluate(GuardRequest request) {
        return Mono.defer(() -> {
                    PolicyEntry policy = policyResolver.resolve(request.route());
                    Mono<StageResult> result = Mono.just(StageResult.proceed(GuardContext.initial(request, policy)));
                    for (GuardStage stage : stages) {
                        result = result.flatMap(previous -> previous.isDenied()
                                ? Mono.just(previous)
                                : runStage(stage, previous.context()));
                    }
                    return result.map(GuardOutcome::of);
                })
                .doOnNext(outcome -> {
                    if (outcome.isAllowed()) {
                        log.debug("Access allowed on {}", request.route().routeId());
                    } else {
                        log.debug("Access denied on {} at {}: {}", request.route().routeId(),
                                outcome.decision().stage(), outcome.decision().reason());
                    }
                })
                .onErrorResume(e -> {
                    log.error("Guard chain failed on {}: {}", request.route().routeId(), e.getMessage(), e);
                    return Mono.just(GuardOutcome.denied(AccessDecision.deny(
                            GuardStageNames.GUARD_CHAIN, DenialReason.INTERNAL_ERROR, "Authorization failed")));
                });
    }

    public List<GuardStage> stages() {
        return stages;
    }

    private Mono<StageResult> runStage(GuardStage stage, GuardContext context) {
        return Mono.defer(() -> stage.apply(context))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(stage.name() + " produced no result")))
                .onErrorResume(e -> {
                    log.error("Stage {} failed on {}: {}", stage.name(),
                            context.request().route().routeId(), e.getMessage(), e);
                    return Mono.just(StageResult.deny(context, AccessDecision.deny(
                            stage.name(), DenialReason.INTERNAL_ERROR, "Authorization failed")));
                });
    }
}
