package com.example.authz.chain.stage;

import com.example.authz.adapter.RoleAdapters;
import com.example.authz.chain.GuardContext;
import com.example.authz.chain.GuardStage;
import com.example.authz.chain.RouteParameters;
import com.example.authz.chain.StageResult;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.GuardStageNames;
import com.example.authz.model.PolicyEntry;
import com.example.authz.model.Principal;
import com.example.authz.policy.PolicyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Enforces {@code requiredScopes}.
 *
 * <p>Store roles are only loaded when scopes are missing and the route addresses
 * a store, to find out whether the store-admin bypass applies. If that load
 * fails, the bypass simply does not apply.
 */
@Slf4j
@RequiredArgsConstructor
public class PermissionStage implements GuardStage {

    private final RoleAdapters roleAdapters;
    private final PolicyEngine policyEngine;
    private final RouteParameters routeParameters;

    @Override
    public String name() {
        return GuardStageNames.PERMISSION_CHECK;
    }

    @Override
    public Mono<StageResult> apply(GuardContext context) {
        PolicyEntry policy = context.policy();
        Principal principal = context.principal();
        if (policy == null || !policy.hasScopeConstraint() || principal.isSiteAdmin()) {
            return Mono.just(StageResult.proceed(context));
        }
        if (principal.missingScopes(policy.requiredScopes()).isEmpty()) {
            return Mono.just(StageResult.proceed(context));
        }

        Optional<String> storeId = routeParameters.storeId(context.request().routeParams(), policy)
                .filter(StringSanitizer::isValidStoreId);

        Mono<Principal> candidate = Mono.just(principal);
        if (storeId.isPresent() && !principal.storeRolesLoaded()) {
            candidate = roleAdapters.withStoreRoles(principal)
                    .onErrorResume(e -> {
                        log.warn("Store role lookup failed for user {}, no store admin bypass: {}",
                                StringSanitizer.forLog(principal.id()), e.getMessage());
                        return Mono.just(principal);
                    });
        }

        return candidate.map(loaded -> {
            GuardContext updated = context.withPrincipal(loaded);
            AccessDecision decision = policyEngine.checkPermissions(loaded, policy, storeId.orElse(null));
            if (decision.isDenied()) {
                log.warn("Permissions denied on {} for user {}: missing {}",
                        context.request().route().routeId(),
                        StringSanitizer.forLog(loaded.id()), decision.missing());
                return StageResult.deny(updated, decision);
            }
            return StageResult.proceed(updated);
        });
    }
}
