package com.example.authz.chain.stage;

import com.example.authz.adapter.RoleAdapters;
import com.example.authz.chain.GuardContext;
import com.example.authz.chain.GuardStage;
import com.example.authz.chain.StageResult;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.GuardStageNames;
import com.example.authz.model.Principal;
import com.example.authz.policy.PolicyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Computes the site-admin flag for every request, replacing whatever the
 * principal carried, then enforces {@code adminRole}.
 *
 * <p>A failing admin lookup means "not a site admin".
 */
@Slf4j
@RequiredArgsConstructor
public class SiteAdminStage implements GuardStage {

    private final RoleAdapters roleAdapters;
    private final PolicyEngine policyEngine;

    @Override
    public String name() {
        return GuardStageNames.SITE_ADMIN_CHECK;
    }

    @Override
    public Mono<StageResult> apply(GuardContext context) {
        Principal principal = context.principal();
        if (principal == null) {
            AccessDecision decision = policyEngine.checkAdminRole(null, context.policy());
            return Mono.just(decision.isDenied()
                    ? StageResult.deny(context, decision)
                    : StageResult.proceed(context));
        }

        return roleAdapters.isSiteAdmin(principal.id())
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Site admin lookup failed for user {}, treating as non-admin: {}",
                            StringSanitizer.forLog(principal.id()), e.getMessage());
                    return Mono.just(false);
                })
                .map(siteAdmin -> {
                    GuardContext updated = context.withPrincipal(principal.withSiteAdmin(siteAdmin));
                    AccessDecision decision = policyEngine.checkAdminRole(updated.principal(), context.policy());
                    if (decision.isDenied()) {
                        log.warn("Admin role required on {} for user {}",
                                context.request().route().routeId(), StringSanitizer.forLog(principal.id()));
                        return StageResult.deny(updated, decision);
                    }
                    return StageResult.proceed(updated);
                });
    }
}
