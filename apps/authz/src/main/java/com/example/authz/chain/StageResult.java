package com.example.authz.chain;

import com.example.authz.model.AccessDecision;

/**
 * Outcome of one stage: continue with {@code context}, or stop with a denial.
 */
public record StageResult(
        GuardContext context,
        AccessDecision decision
) {
    public static StageResult proceed(GuardContext context) {
        return new StageResult(context, AccessDecision.allow());
    }

    public static StageResult deny(GuardContext context, AccessDecision decision) {
        if (decision.allowed()) {
            throw new IllegalArgumentException("Deny result requires a deny decision");
        }
        return new StageResult(context, decision);
    }

    public boolean isDenied() {
        return decision.isDenied();
    }
}
