package com.example.authz.exception;

import com.example.authz.model.DenialReason;
import lombok.Getter;

// Caller could not be authenticated. Always reported as 401.
@Getter
public class AuthenticationException extends RuntimeException {

    private final DenialReason reason;

    public AuthenticationException(DenialReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthenticationException(DenialReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
