package com.example.authz.filter;

import com.example.authz.common.util.StringSanitizer;
import com.example.authz.exception.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Writes 401/403 JSON bodies from a WebFilter.
 */
@Slf4j
public final class FilterResponseUtils {

    static final String UNAUTHORIZED_MESSAGE = "Authentication required";
    static final String FORBIDDEN_MESSAGE = "Access denied";

    private FilterResponseUtils() {}

    /**
     * 401 with a generic body; the failure reason is never disclosed.
     */
    @NonNull
    public static Mono<Void> unauthorized(
            @NonNull ServerWebExchange exchange,
            @Nullable ObjectMapper objectMapper) {
        return error(exchange, HttpStatus.UNAUTHORIZED, UNAUTHORIZED_MESSAGE, null, Set.of(), objectMapper);
    }

    /**
     * 403 carrying the machine-readable reason code and any missing permissions.
     */
    @NonNull
    public static Mono<Void> forbidden(
            @NonNull ServerWebExchange exchange,
            @NonNull String code,
            @NonNull Set<String> missing,
            @Nullable ObjectMapper objectMapper) {
        return error(exchange, HttpStatus.FORBIDDEN, FORBIDDEN_MESSAGE, code, missing, objectMapper);
    }

    @NonNull
    private static Mono<Void> error(
            @NonNull ServerWebExchange exchange,
            @NonNull HttpStatus status,
            @NonNull String message,
            @Nullable String code,
            @NonNull Set<String> missing,
            @Nullable ObjectMapper objectMapper) {

        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        String path = exchange.getRequest().getPath().value();

        if (objectMapper != null) {
            try {
                ErrorResponse errorResponse = ErrorResponse.of(
                        status.value(), status.getReasonPhrase(), message, path, code, missing);
                return writeResponse(exchange, objectMapper.writeValueAsString(errorResponse));
            } catch (Exception e) {
                log.warn("Failed to serialize error response with ObjectMapper: {}", e.getMessage());
                // Fall through to manual JSON building
            }
        }

        return writeResponse(exchange, buildSafeJson(status, message, code));
    }

    @NonNull
    private static String buildSafeJson(@NonNull HttpStatus status, @NonNull String message, @Nullable String code) {
        StringBuilder json = new StringBuilder();
        json.append("{\"status\":").append(status.value());
        json.append(",\"error\":\"").append(StringSanitizer.escapeJson(status.getReasonPhrase())).append("\"");
        json.append(",\"message\":\"").append(StringSanitizer.escapeJson(message)).append("\"");
        if (code != null) {
            json.append(",\"code\":\"").append(StringSanitizer.escapeJson(code)).append("\"");
        }
        json.append("}");
        return json.toString();
    }

    @NonNull
    private static Mono<Void> writeResponse(@NonNull ServerWebExchange exchange, @NonNull String body) {
        return exchange.getResponse()
                .writeWith(Mono.just(exchange.getResponse()
                        .bufferFactory()
                        .wrap(body.getBytes(StandardCharsets.UTF_8))));
    }
}
