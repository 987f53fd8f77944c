package com.example.authz.model;

import java.util.Objects;

/**
 * Ownership constraint of a route.
 *
 * @param lookup             name under which the entity collaborator is registered
 * @param idParam            route parameter carrying the target entity id
 * @param allowMissingEntity when true a missing entity is treated as "not owned" instead of "not found"
 */
public record EntityOwnerConfig(
        String lookup,
        String idParam,
        boolean allowMissingEntity
) {
    public static final String DEFAULT_ID_PARAM = "id";

    public EntityOwnerConfig {
        Objects.requireNonNull(lookup, "lookup");
        if (idParam == null || idParam.isBlank()) {
            idParam = DEFAULT_ID_PARAM;
        }
    }

    public static EntityOwnerConfig of(String lookup) {
        return new EntityOwnerConfig(lookup, DEFAULT_ID_PARAM, false);
    }
}
