package com.example.authz.model;

import java.util.Locale;

/**
 * Resources a permission scope can refer to. Closed set.
 */
public enum PermissionResource {
    ORDERS,
    PRODUCTS,
    REVIEWS,
    STORES,
    CARTS,
    CATEGORIES,
    VARIANTS,
    INVENTORY,
    NEWS,
    ANALYTICS,
    USERS;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PermissionResource fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
