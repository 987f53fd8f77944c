package com.example.authz.model;

import java.util.Locale;

public enum PermissionAction {
    CREATE,
    READ,
    UPDATE,
    DELETE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PermissionAction fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
