package com.example.authz.filter;

import com.example.authz.audit.AuthzAuditService;
import com.example.authz.chain.GuardChain;
import com.example.authz.chain.GuardOutcome;
import com.example.authz.chain.GuardRequest;
import com.example.authz.context.PrincipalHolder;
import com.example.authz.exception.GuardConfigurationException;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.DenialReason;
import com.example.authz.observability.metrics.AuthzMetrics;
import com.example.authz.policy.RouteDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.PathContainer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.result.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the {@link GuardChain} for every request routed to an annotated controller.
 *
 * <p>Denials are answered here: 401 for authentication failures, 403 for
 * everything else. On allow the principal is written to the Reactor context
 * ({@link PrincipalHolder}) and, with the ownership-checked entity, to exchange
 * attributes.
 *
 * <p>Requests on a public path, and requests without a {@link HandlerMethod},
 * pass through untouched.
 */
@Slf4j
public class GuardChainWebFilter implements WebFilter, Ordered {

    public static final String PRINCIPAL_ATTRIBUTE = GuardChainWebFilter.class.getName() + ".PRINCIPAL";
    public static final String ENTITY_ATTRIBUTE = GuardChainWebFilter.class.getName() + ".ENTITY";

    static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 30;

    private final RequestMappingHandlerMapping handlerMapping;
    private final GuardChain guardChain;
    private final AuthzAuditService auditService;
    private final AuthzMetrics metrics;
    private final ObjectMapper objectMapper;
    private final List<PathPattern> publicPaths;

    public GuardChainWebFilter(
            RequestMappingHandlerMapping handlerMapping,
            GuardChain guardChain,
            @Nullable AuthzAuditService auditService,
            @Nullable AuthzMetrics metrics,
            ObjectMapper objectMapper,
            List<String> publicPaths) {
        this.handlerMapping = handlerMapping;
        this.guardChain = guardChain;
        this.auditService = auditService;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.publicPaths = publicPaths.stream()
                .map(PathPatternParser.defaultInstance::parse)
                .toList();
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        if (isPublicPath(exchange)) {
            return chain.filter(exchange);
        }

        return handlerMapping.getHandler(exchange)
                .filter(HandlerMethod.class::isInstance)
                .cast(HandlerMethod.class)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(handlerMethod -> handlerMethod.isPresent()
                        ? authorize(exchange, chain, handlerMethod.get())
                        : chain.filter(exchange)); // No handler = nothing to guard
    }

    private Mono<Void> authorize(ServerWebExchange exchange, WebFilterChain chain, HandlerMethod handlerMethod) {
        RouteDescriptor route;
        try {
            route = RouteDescriptor.from(handlerMethod);
        } catch (GuardConfigurationException e) {
            log.error("Cannot authorize {}: {}", handlerMethod.getShortLogMessage(), e.getMessage());
            return FilterResponseUtils.forbidden(
                    exchange, DenialReason.INTERNAL_ERROR.name(), Set.of(), objectMapper);
        }
        GuardRequest request = new GuardRequest(
                route,
                exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION),
                routeParams(exchange));

        long start = System.nanoTime();
        return guardChain.evaluate(request)
                .flatMap(outcome -> {
                    if (metrics != null) {
                        metrics.recordDecision(outcome.decision(), Duration.ofNanos(System.nanoTime() - start));
                    }
                    audit(outcome, route, exchange);
                    if (outcome.isAllowed()) {
                        return proceed(exchange, chain, outcome);
                    }
                    return reject(exchange, outcome.decision());
                });
    }

    private Mono<Void> proceed(ServerWebExchange exchange, WebFilterChain chain, GuardOutcome outcome) {
        exchange.getAttributes().put(PRINCIPAL_ATTRIBUTE, outcome.principal());
        if (outcome.entity() != null) {
            exchange.getAttributes().put(ENTITY_ATTRIBUTE, outcome.entity());
        }
        return chain.filter(exchange)
                .contextWrite(PrincipalHolder.withPrincipal(outcome.principal()));
    }

    private Mono<Void> reject(ServerWebExchange exchange, AccessDecision decision) {
        if (decision.isUnauthenticated()) {
            return FilterResponseUtils.unauthorized(exchange, objectMapper);
        }
        return FilterResponseUtils.forbidden(exchange, decision.reason().name(), decision.missing(), objectMapper);
    }

    private void audit(GuardOutcome outcome, RouteDescriptor route, ServerWebExchange exchange) {
        if (auditService == null) {
            return;
        }
        try {
            auditService.logDecision(outcome, route.routeId(), exchange.getRequest());
        } catch (RuntimeException e) {
            log.error("Failed to audit decision for {}: {}", route.routeId(), e.getMessage());
        }
    }

    // Path variables of the matched route only; query parameters never reach the chain.
    private Map<String, String> routeParams(ServerWebExchange exchange) {
        Map<String, String> params = new HashMap<>();
        Map<String, String> pathVariables = exchange.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (pathVariables != null) {
            pathVariables.forEach((name, value) -> {
                if (value != null) {
                    params.put(name, value);
                }
            });
        }
        return params;
    }

    private boolean isPublicPath(ServerWebExchange exchange) {
        if (publicPaths.isEmpty()) {
            return false;
        }
        PathContainer path = exchange.getRequest().getPath().pathWithinApplication();
        return publicPaths.stream().anyMatch(pattern -> pattern.matches(path));
    }
}
