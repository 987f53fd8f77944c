package com.example.authz.token;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts the token from an {@code Authorization} header value.
 *
 * <p>Accepts {@code "Bearer <token>"} with a case-insensitive scheme, or a bare
 * token. Any other scheme ({@code Basic ...}) yields empty.
 */
public final class BearerTokenExtractor {

    private static final String BEARER = "bearer";

    private BearerTokenExtractor() {
        // Utility class
    }

    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        int space = indexOfWhitespace(trimmed);
        if (space < 0) {
            // Bare token; a lone scheme name is not a token
            return trimmed.toLowerCase(Locale.ROOT).equals(BEARER) ? Optional.empty() : Optional.of(trimmed);
        }
        String scheme = trimmed.substring(0, space);
        String token = trimmed.substring(space + 1).strip();
        if (!scheme.toLowerCase(Locale.ROOT).equals(BEARER) || token.isEmpty() || indexOfWhitespace(token) >= 0) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    private static int indexOfWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
