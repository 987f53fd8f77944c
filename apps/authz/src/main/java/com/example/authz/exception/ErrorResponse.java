package com.example.authz.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String code,
        Set<String> missing
) {
    public static ErrorResponse of(int status, String error, String message, String path,
                                   String code, Set<String> missing) {
        return new ErrorResponse(Instant.now(), status, error, message, path, code, missing);
    }
}
