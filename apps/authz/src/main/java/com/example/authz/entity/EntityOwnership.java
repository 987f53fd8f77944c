package com.example.authz.entity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads owner and store references from a loaded entity.
 *
 * <p>Typed entities implement {@link UserOwned} / {@link StoreOwned}. Lookups that
 * return plain maps (document stores, projections) are read by the usual field
 * names: {@code userId}, {@code ownerId}, {@code authorId}, then the {@code id} of a
 * nested {@code user}, {@code author} or {@code owner}.
 */
public final class EntityOwnership {

    private static final List<String> OWNER_FIELDS = List.of("userId", "ownerId", "authorId");
    private static final List<String> OWNER_REFERENCES = List.of("user", "author", "owner");
    private static final List<String> STORE_FIELDS = List.of("storeId", "store_id");

    private EntityOwnership() {
        // Utility class
    }

    public static Optional<String> ownerIdOf(Object entity) {
        if (entity instanceof UserOwned owned) {
            return Optional.ofNullable(owned.ownerId());
        }
        if (entity instanceof Map<?, ?> map) {
            for (String field : OWNER_FIELDS) {
                Object value = map.get(field);
                if (value != null) {
                    return Optional.of(value.toString());
                }
            }
            for (String reference : OWNER_REFERENCES) {
                if (map.get(reference) instanceof Map<?, ?> nested && nested.get("id") != null) {
                    return Optional.of(nested.get("id").toString());
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<String> storeIdOf(Object entity) {
        if (entity instanceof StoreOwned owned) {
            return Optional.ofNullable(owned.storeId());
        }
        if (entity instanceof Map<?, ?> map) {
            for (String field : STORE_FIELDS) {
                Object value = map.get(field);
                if (value != null) {
                    return Optional.of(value.toString());
                }
            }
        }
        return Optional.empty();
    }
}
