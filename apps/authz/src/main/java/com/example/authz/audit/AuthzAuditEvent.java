package com.example.authz.audit;

import com.example.authz.chain.GuardOutcome;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.DenialKind;
import com.example.authz.model.DenialReason;
import com.example.authz.model.Principal;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Structured audit event for one guard chain decision.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        String stage,
        String reason,
        Set<String> missingPermissions,

        // Subject
        String userId,
        Boolean siteAdmin,

        // Route
        String route,

        // Request context
        String path,
        String method,
        String clientIp,
        String userAgent
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static AuthzAuditEvent from(
            GuardOutcome guardOutcome,
            String route,
            RequestContext requestContext) {

        AccessDecision decision = guardOutcome.decision();
        Principal principal = guardOutcome.principal();

        return new AuthzAuditEvent(
                requestContext.correlationId(),
                Instant.now(),
                requestContext.correlationId(),
                outcomeOf(decision),
                decision.stage(),
                decision.reason() != null ? decision.reason().name() : null,
                decision.missing(),
                principal != null ? principal.id() : null,
                principal != null ? principal.siteAdmin() : null,
                route,
                requestContext.path(),
                requestContext.method(),
                requestContext.clientIp(),
                requestContext.userAgent()
        );
    }

    // Internal and wiring failures are errors, not ordinary denials.
    static Outcome outcomeOf(AccessDecision decision) {
        if (decision.allowed()) {
            return Outcome.ALLOW;
        }
        if (decision.reason() == DenialReason.INTERNAL_ERROR
                || decision.reason().kind() == DenialKind.CONFIGURATION_ERROR) {
            return Outcome.ERROR;
        }
        return Outcome.DENY;
    }

    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "authz_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("correlation_id", correlationId != null ? correlationId : ""),
                Map.entry("outcome", outcome.name()),
                Map.entry("stage", stage != null ? stage : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("missing_permissions", missingPermissions != null ? missingPermissions : Set.of()),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("site_admin", siteAdmin != null ? siteAdmin : ""),
                Map.entry("route", route != null ? route : ""),
                Map.entry("path", path != null ? path : ""),
                Map.entry("method", method != null ? method : ""),
                Map.entry("client_ip", clientIp != null ? clientIp : ""),
                Map.entry("user_agent", userAgent != null ? userAgent : "")
        );
    }

    public record RequestContext(
            String correlationId,
            String path,
            String method,
            String clientIp,
            String userAgent
    ) {
        public static RequestContext empty() {
            return new RequestContext(null, null, null, null, null);
        }
    }
}
