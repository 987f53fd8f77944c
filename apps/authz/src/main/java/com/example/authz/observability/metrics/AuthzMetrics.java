package com.example.authz.observability.metrics;

import com.example.authz.model.AccessDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Guard chain decision metrics.
 * Tag values are bounded: stage names and denial reasons come from closed sets.
 */
public class AuthzMetrics {

    static final String DECISION = "authz.decision";
    static final String DECISION_DETAILED = "authz.decision.detailed";
    static final String CHAIN_DURATION = "authz.chain.duration";

    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter decisionAllowed;
    private final Counter decisionDenied;

    public AuthzMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.decisionAllowed = Counter.builder(DECISION)
                .tag("result", "allowed")
                .description("Guard chain decisions that allowed access")
                .register(registry);

        this.decisionDenied = Counter.builder(DECISION)
                .tag("result", "denied")
                .description("Guard chain decisions that denied access")
                .register(registry);
    }

    public void recordDecision(@NonNull AccessDecision decision, @NonNull Duration duration) {
        if (decision.allowed()) {
            decisionAllowed.increment();
        } else {
            decisionDenied.increment();
            registry.counter(DECISION_DETAILED,
                            Tags.of("stage", sanitizeTag(decision.stage()),
                                    "reason", sanitizeTag(decision.reason() != null ? decision.reason().name() : null)))
                    .increment();
        }

        Timer.builder(CHAIN_DURATION)
                .tag("result", decision.allowed() ? "allowed" : "denied")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized;
    }
}
