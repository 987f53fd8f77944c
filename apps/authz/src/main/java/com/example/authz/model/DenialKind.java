package com.example.authz.model;

public enum DenialKind {
    UNAUTHENTICATED,
    FORBIDDEN,
    // A route declares a constraint that cannot be evaluated. Reported as FORBIDDEN.
    CONFIGURATION_ERROR;

    public DenialKind atBoundary() {
        return this == CONFIGURATION_ERROR ? FORBIDDEN : this;
    }
}
