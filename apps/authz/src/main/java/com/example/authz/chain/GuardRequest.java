package com.example.authz.chain;

import com.example.authz.policy.RouteDescriptor;

import java.util.Map;
import java.util.Objects;

/**
 * Input of one guard chain evaluation.
 *
 * @param route         the handler the request was routed to
 * @param rawCredential raw {@code Authorization} header value (or bare token), may be null
 * @param routeParams   path variables of the matched route
 */
public record GuardRequest(
        RouteDescriptor route,
        String rawCredential,
        Map<String, String> routeParams
) {
    public GuardRequest {
        Objects.requireNonNull(route, "route");
        routeParams = routeParams == null ? Map.of() : Map.copyOf(routeParams);
    }
}
