package com.example.authz.model;

public record StoreSummary(
        String id,
        String name,
        boolean active
) {
}
