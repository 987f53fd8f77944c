package com.example.authz.entity;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named entity collaborators referenced by {@code @EntityOwner(lookup = ...)}.
 *
 * <p>Built once at startup; immutable afterwards.
 */
@Slf4j
public final class EntityLookupRegistry {

    private static final EntityLookupRegistry EMPTY = new EntityLookupRegistry(Map.of());

    private final Map<String, Object> lookups;

    private EntityLookupRegistry(Map<String, Object> lookups) {
        this.lookups = Collections.unmodifiableMap(new LinkedHashMap<>(lookups));
    }

    public static EntityLookupRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Object> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(lookups.get(name));
    }

    public Set<String> names() {
        return lookups.keySet();
    }

    static boolean isSupported(Object lookup) {
        return lookup instanceof EntityByIdLookup<?>
                || lookup instanceof FindByIdLookup<?>
                || lookup instanceof FindOneLookup<?>;
    }

    public static final class Builder {

        private final Map<String, Object> lookups = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, Object lookup) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(lookup, "lookup");
            if (lookups.containsKey(name)) {
                throw new IllegalStateException("Entity lookup already registered: " + name);
            }
            if (!isSupported(lookup)) {
                log.warn("Entity lookup '{}' ({}) implements no supported lookup method",
                        name, lookup.getClass().getName());
            }
            lookups.put(name, lookup);
            return this;
        }

        public EntityLookupRegistry build() {
            return new EntityLookupRegistry(lookups);
        }
    }
}
