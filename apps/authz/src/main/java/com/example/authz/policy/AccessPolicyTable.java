package com.example.authz.policy;

import com.example.authz.model.PolicyEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static per-controller mapping of handler name to {@link PolicyEntry}.
 *
 * <p>Used when a handler carries no policy annotations. A controller that extends
 * a base controller builds its table from the base one with {@link #extend(AccessPolicyTable)};
 * entries declared by the child then override the base entry field by field.
 *
 * <pre>
 * static final AccessPolicyTable POLICIES = AccessPolicyTable.builder()
 *         .policy("findAllByStore", PolicyEntry.builder().storeRoles(Set.of(StoreRole.ADMIN)).build())
 *         .policy("remove", PolicyEntry.builder().adminRole(AdminRole.ADMIN).build())
 *         .build();
 * </pre>
 */
public final class AccessPolicyTable {

    private final Map<String, PolicyEntry> entries;

    private AccessPolicyTable(Map<String, PolicyEntry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder(Map.of());
    }

    public static Builder extend(AccessPolicyTable base) {
        Objects.requireNonNull(base, "base");
        return new Builder(base.entries);
    }

    /**
     * Merges two tables. For a handler present in both, {@code child}'s fields
     * override {@code base}'s.
     */
    public static AccessPolicyTable merge(AccessPolicyTable base, AccessPolicyTable child) {
        Builder builder = extend(base);
        child.entries.forEach(builder::policy);
        return builder.build();
    }

    public Optional<PolicyEntry> find(String handlerName) {
        if (handlerName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(handlerName));
    }

    public Set<String> handlerNames() {
        return entries.keySet();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "AccessPolicyTable" + entries.keySet();
    }

    public static final class Builder {

        private final Map<String, PolicyEntry> entries;

        private Builder(Map<String, PolicyEntry> base) {
            this.entries = new LinkedHashMap<>(base);
        }

        public Builder policy(String handlerName, PolicyEntry entry) {
            Objects.requireNonNull(handlerName, "handlerName");
            Objects.requireNonNull(entry, "entry");
            entries.merge(handlerName, entry, PolicyEntry::overrideWith);
            return this;
        }

        public AccessPolicyTable build() {
            return new AccessPolicyTable(entries);
        }
    }
}
