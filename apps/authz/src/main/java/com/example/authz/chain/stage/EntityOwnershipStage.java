package com.example.authz.chain.stage;

import com.example.authz.adapter.RoleAdapters;
import com.example.authz.chain.GuardContext;
import com.example.authz.chain.GuardStage;
import com.example.authz.chain.StageResult;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.entity.EntityOwnerResolver;
import com.example.authz.entity.EntityOwnership;
import com.example.authz.exception.GuardConfigurationException;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.DenialReason;
import com.example.authz.model.EntityOwnerConfig;
import com.example.authz.model.GuardStageNames;
import com.example.authz.model.PolicyEntry;
import com.example.authz.model.Principal;
import com.example.authz.policy.PolicyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Loads the addressed entity and checks the caller owns it.
 *
 * <p>Store roles are loaded only when the entity belongs to a store and the
 * caller is not its direct owner.
 */
@Slf4j
@RequiredArgsConstructor
public class EntityOwnershipStage implements GuardStage {

    private final EntityOwnerResolver entityOwnerResolver;
    private final RoleAdapters roleAdapters;
    private final PolicyEngine policyEngine;

    @Override
    public String name() {
        return GuardStageNames.ENTITY_OWNERSHIP_CHECK;
    }

    @Override
    public Mono<StageResult> apply(GuardContext context) {
        PolicyEntry policy = context.policy();
        Principal principal = context.principal();
        if (policy == null || !policy.hasOwnershipConstraint() || principal.isSiteAdmin()) {
            return Mono.just(StageResult.proceed(context));
        }

        EntityOwnerConfig config = policy.entityOwner();
        return entityOwnerResolver.resolveOwner(config, context.request().routeParams())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(entity -> withRolesIfNeeded(principal, entity)
                        .map(loaded -> decide(context.withPrincipal(loaded), entity.orElse(null))))
                .onErrorResume(GuardConfigurationException.class, e -> {
                    log.error("Ownership check misconfigured on {}: {}",
                            context.request().route().routeId(), e.getMessage());
                    return deny(context, DenialReason.LOOKUP_NOT_CONFIGURED, "Entity lookup not configured");
                })
                .onErrorResume(e -> {
                    log.error("Entity lookup '{}' failed on {}: {}",
                            config.lookup(), context.request().route().routeId(), e.getMessage());
                    return deny(context, DenialReason.LOOKUP_FAILED, "Entity lookup failed");
                });
    }

    private Mono<Principal> withRolesIfNeeded(Principal principal, Optional<Object> entity) {
        if (entity.isEmpty() || principal.storeRolesLoaded()) {
            return Mono.just(principal);
        }
        boolean directOwner = EntityOwnership.ownerIdOf(entity.get())
                .map(principal.id()::equals)
                .orElse(false);
        if (directOwner || EntityOwnership.storeIdOf(entity.get()).isEmpty()) {
            return Mono.just(principal);
        }
        return roleAdapters.withStoreRoles(principal);
    }

    private StageResult decide(GuardContext context, Object entity) {
        AccessDecision decision = policyEngine.checkOwnership(context.principal(), context.policy(), entity);
        if (decision.isDenied()) {
            log.warn("Ownership denied on {} for user {}: {}",
                    context.request().route().routeId(),
                    StringSanitizer.forLog(context.principal().id()), decision.reason());
            return StageResult.deny(context, decision);
        }
        return StageResult.proceed(context.withEntity(entity));
    }

    private Mono<StageResult> deny(GuardContext context, DenialReason reason, String detail) {
        return Mono.just(StageResult.deny(context, AccessDecision.deny(name(), reason, detail)));
    }
}
