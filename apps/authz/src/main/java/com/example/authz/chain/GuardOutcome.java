package com.example.authz.chain;

import com.example.authz.model.AccessDecision;
import com.example.authz.model.Principal;
import org.springframework.lang.Nullable;

/**
 * Final result of the chain.
 *
 * @param decision  allow, or the first denial
 * @param principal the principal as far as it was computed (null when the token stage denied)
 * @param entity    the entity loaded for ownership-scoped routes
 */
public record GuardOutcome(
        AccessDecision decision,
        @Nullable Principal principal,
        @Nullable Object entity
) {
    public static GuardOutcome of(StageResult result) {
        GuardContext context = result.context();
        return new GuardOutcome(result.decision(), context.principal(), context.entity());
    }

    public static GuardOutcome denied(AccessDecision decision) {
        return new GuardOutcome(decision, null, null);
    }

    public boolean isAllowed() {
        return decision.allowed();
    }
}
