package com.example.authz.model;

import java.util.Objects;

// One role held by a user in one store. The owning domain keeps at most one per (user, store).
public record StoreRoleAssignment(
        String userId,
        String storeId,
        StoreRole roleName
) {
    public StoreRoleAssignment {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(storeId, "storeId");
        Objects.requireNonNull(roleName, "roleName");
    }

    public boolean isForStore(String storeId) {
        return this.storeId.equals(storeId);
    }
}
