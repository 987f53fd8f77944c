package com.example.authz.model;

import java.util.Set;

/**
 * Result of running the guard chain, or one of its checks, for a request.
 *
 * <p>{@code deniedKind} is already mapped to what the hosting layer reports
 * (configuration errors surface as {@link DenialKind#FORBIDDEN}); the finer
 * category stays available through {@link DenialReason#kind()}.
 */
public record AccessDecision(
        boolean allowed,
        DenialKind deniedKind,
        DenialReason reason,
        String stage,
        String detail,
        Set<String> missing
) {
    private static final AccessDecision ALLOW = new AccessDecision(true, null, null, null, null, Set.of());

    public AccessDecision {
        missing = missing == null ? Set.of() : Set.copyOf(missing);
    }

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(String stage, DenialReason reason, String detail) {
        return new AccessDecision(false, reason.kind().atBoundary(), reason, stage, detail, Set.of());
    }

    public static AccessDecision deny(String stage, DenialReason reason, String detail, Set<String> missing) {
        return new AccessDecision(false, reason.kind().atBoundary(), reason, stage, detail, missing);
    }

    public boolean isDenied() {
        return !allowed;
    }

    public boolean isUnauthenticated() {
        return deniedKind == DenialKind.UNAUTHENTICATED;
    }

    public boolean isConfigurationError() {
        return reason != null && reason.kind() == DenialKind.CONFIGURATION_ERROR;
    }
}
