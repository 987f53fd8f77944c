package com.example.authz.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A granular {@code resource:action} grant, e.g. {@code orders:read}.
 */
public record PermissionScope(
        PermissionResource resource,
        PermissionAction action
) {
    private static final char SEPARATOR = ':';

    public PermissionScope {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(action, "action");
    }

    public static PermissionScope of(PermissionResource resource, PermissionAction action) {
        return new PermissionScope(resource, action);
    }

    /**
     * Parses {@code "resource:action"}, case-insensitive.
     *
     * @throws IllegalArgumentException when the value is malformed or names an unknown resource or action
     */
    public static PermissionScope parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Permission scope must not be null");
        }
        int idx = value.indexOf(SEPARATOR);
        if (idx <= 0 || idx != value.lastIndexOf(SEPARATOR) || idx == value.length() - 1) {
            throw new IllegalArgumentException("Permission scope must look like 'resource:action': " + value);
        }
        return new PermissionScope(
                PermissionResource.fromValue(value.substring(0, idx)),
                PermissionAction.fromValue(value.substring(idx + 1)));
    }

    public static Optional<PermissionScope> tryParse(String value) {
        try {
            return Optional.of(parse(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String value() {
        return resource.value() + SEPARATOR + action.value();
    }

    @Override
    public String toString() {
        return value();
    }
}
