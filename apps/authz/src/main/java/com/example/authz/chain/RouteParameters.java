package com.example.authz.chain;

import com.example.authz.model.PolicyEntry;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the store id a request addresses.
 *
 * <p>A policy's own {@code storeIdParam} is the only name consulted when set;
 * otherwise the configured candidates are tried in order and the first present
 * value wins.
 */
public class RouteParameters {

    public static final List<String> DEFAULT_STORE_ID_PARAMS = List.of("storeId", "id", "store_id");

    private final List<String> storeIdParams;

    public RouteParameters(List<String> storeIdParams) {
        this.storeIdParams = storeIdParams == null || storeIdParams.isEmpty()
                ? DEFAULT_STORE_ID_PARAMS
                : List.copyOf(storeIdParams);
    }

    public Optional<String> storeId(Map<String, String> routeParams, @Nullable PolicyEntry policy) {
        if (policy != null && policy.storeIdParam() != null) {
            return present(routeParams.get(policy.storeIdParam()));
        }
        for (String name : storeIdParams) {
            Optional<String> value = present(routeParams.get(name));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public List<String> storeIdParams() {
        return storeIdParams;
    }

    private static Optional<String> present(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
