package com.example.authz.model;

/**
 * Machine-readable reason attached to every deny decision.
 */
public enum DenialReason {
    MISSING_CREDENTIAL(DenialKind.UNAUTHENTICATED),
    INVALID_CREDENTIAL(DenialKind.UNAUTHENTICATED),
    ACCOUNT_INACTIVE(DenialKind.UNAUTHENTICATED),
    ACCOUNT_STATUS_UNAVAILABLE(DenialKind.UNAUTHENTICATED),

    AUTHENTICATION_REQUIRED(DenialKind.FORBIDDEN),
    ADMIN_REQUIRED(DenialKind.FORBIDDEN),
    STORE_ROLE_REQUIRED(DenialKind.FORBIDDEN),
    INVALID_STORE_ID(DenialKind.FORBIDDEN),
    STORE_NOT_FOUND(DenialKind.FORBIDDEN),
    ROLE_LOOKUP_FAILED(DenialKind.FORBIDDEN),
    ENTITY_NOT_FOUND(DenialKind.FORBIDDEN),
    NOT_OWNER(DenialKind.FORBIDDEN),
    LOOKUP_FAILED(DenialKind.FORBIDDEN),
    MISSING_PERMISSIONS(DenialKind.FORBIDDEN),
    INTERNAL_ERROR(DenialKind.FORBIDDEN),

    STORE_ID_MISSING(DenialKind.CONFIGURATION_ERROR),
    LOOKUP_NOT_CONFIGURED(DenialKind.CONFIGURATION_ERROR);

    private final DenialKind kind;

    DenialReason(DenialKind kind) {
        this.kind = kind;
    }

    public DenialKind kind() {
        return kind;
    }
}
