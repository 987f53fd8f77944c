package com.example.authz.chain.stage;

import com.example.authz.adapter.RoleAdapters;
import com.example.authz.chain.GuardContext;
import com.example.authz.chain.GuardStage;
import com.example.authz.chain.RouteParameters;
import com.example.authz.chain.StageResult;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.DenialReason;
import com.example.authz.model.GuardStageNames;
import com.example.authz.model.PolicyEntry;
import com.example.authz.model.Principal;
import com.example.authz.policy.PolicyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Enforces {@code storeRoles} against the store addressed by the route.
 *
 * <p>Order of checks: store id present, well formed, store exists, then the
 * caller's confirmed role in that store. Site admins skip all of it.
 */
@Slf4j
@RequiredArgsConstructor
public class StoreRoleStage implements GuardStage {

    private final RoleAdapters roleAdapters;
    private final PolicyEngine policyEngine;
    private final RouteParameters routeParameters;

    @Override
    public String name() {
        return GuardStageNames.STORE_ROLE_CHECK;
    }

    @Override
    public Mono<StageResult> apply(GuardContext context) {
        PolicyEntry policy = context.policy();
        Principal principal = context.principal();
        if (policy == null || !policy.hasStoreRoleConstraint() || principal.isSiteAdmin()) {
            return Mono.just(StageResult.proceed(context));
        }

        Optional<String> storeId = routeParameters.storeId(context.request().routeParams(), policy);
        if (storeId.isEmpty()) {
            log.error("Route {} requires store roles but carries no store id parameter (tried {})",
                    context.request().route().routeId(),
                    policy.storeIdParam() != null ? policy.storeIdParam() : routeParameters.storeIdParams());
            return deny(context, DenialReason.STORE_ID_MISSING, "Store id not found in route parameters");
        }
        if (!StringSanitizer.isValidStoreId(storeId.get())) {
            log.warn("Malformed store id on {}: {}",
                    context.request().route().routeId(), StringSanitizer.forLog(storeId.get()));
            return deny(context, DenialReason.INVALID_STORE_ID, "Invalid store id format");
        }

        String id = storeId.get();
        return roleAdapters.findStore(id)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(store -> {
                    if (store.isEmpty()) {
                        log.warn("Store {} not found", StringSanitizer.forLog(id));
                        return deny(context, DenialReason.STORE_NOT_FOUND, "Store not found");
                    }
                    return roleAdapters.withStoreRoles(principal)
                            .map(loaded -> decide(context.withPrincipal(loaded), id));
                })
                .onErrorResume(e -> {
                    log.error("Store role lookup failed for user {} in store {}: {}",
                            StringSanitizer.forLog(principal.id()), StringSanitizer.forLog(id), e.getMessage());
                    return deny(context, DenialReason.ROLE_LOOKUP_FAILED, "Store role lookup failed");
                });
    }

    private StageResult decide(GuardContext context, String storeId) {
        AccessDecision decision = policyEngine.checkStoreRoles(context.principal(), context.policy(), storeId);
        if (decision.isDenied()) {
            log.warn("Store role denied on {} for user {} in store {}",
                    context.request().route().routeId(),
                    StringSanitizer.forLog(context.principal().id()), StringSanitizer.forLog(storeId));
            return StageResult.deny(context, decision);
        }
        return StageResult.proceed(context);
    }

    private Mono<StageResult> deny(GuardContext context, DenialReason reason, String detail) {
        return Mono.just(StageResult.deny(context, AccessDecision.deny(name(), reason, detail)));
    }
}
