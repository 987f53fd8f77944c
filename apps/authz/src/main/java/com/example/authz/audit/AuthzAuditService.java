package com.example.authz.audit;

import com.example.authz.chain.GuardOutcome;
import com.example.authz.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.net.InetSocketAddress;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Publishes one structured JSON event per guard chain decision to the
 * {@code AUTHZ_AUDIT} logger.
 */
@RequiredArgsConstructor
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private static final String HEADER_CORRELATION_ID = "X-Correlation-Id";
    private static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";
    private static final String HEADER_USER_AGENT = "User-Agent";

    private static final Pattern CORRELATION_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile(
            "^([0-9]{1,3}\\.){3}[0-9]{1,3}$|^([0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}$");

    private static final int MAX_CORRELATION_ID_LENGTH = 64;
    private static final int MAX_USER_AGENT_LENGTH = 500;
    private static final int MAX_PATH_LENGTH = 2000;

    private final ObjectMapper objectMapper;

    public void logDecision(
            @NonNull GuardOutcome outcome,
            @NonNull String route,
            @Nullable ServerHttpRequest request) {

        AuthzAuditEvent.RequestContext context = extractRequestContext(request);
        logEvent(AuthzAuditEvent.from(outcome, route, context));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            switch (event.outcome()) {
                case ALLOW -> AUDIT_LOG.info(json);
                case DENY -> AUDIT_LOG.warn(json);
                case ERROR -> AUDIT_LOG.error(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("AuthZ {} - user={}, route={}, stage={}, reason={}",
                    event.outcome(),
                    StringSanitizer.forLog(event.userId()),
                    StringSanitizer.forLog(event.route()),
                    event.stage(),
                    event.reason());
        }
    }

    @NonNull
    private AuthzAuditEvent.RequestContext extractRequestContext(@Nullable ServerHttpRequest request) {
        if (request == null) {
            return AuthzAuditEvent.RequestContext.empty();
        }

        String path = request.getPath().value();
        return new AuthzAuditEvent.RequestContext(
                extractCorrelationId(request),
                path.isBlank() ? "/" : StringSanitizer.truncate(path, MAX_PATH_LENGTH),
                request.getMethod().name(),
                extractClientIp(request),
                StringSanitizer.truncate(request.getHeaders().getFirst(HEADER_USER_AGENT), MAX_USER_AGENT_LENGTH)
        );
    }

    // Falls back to a fresh UUID when the header is missing or malformed.
    @NonNull
    private String extractCorrelationId(@NonNull ServerHttpRequest request) {
        String correlationId = request.getHeaders().getFirst(HEADER_CORRELATION_ID);
        if (correlationId == null || correlationId.isBlank()) {
            return UUID.randomUUID().toString();
        }
        String trimmed = correlationId.trim();
        if (trimmed.length() > MAX_CORRELATION_ID_LENGTH || !CORRELATION_ID_PATTERN.matcher(trimmed).matches()) {
            AUDIT_LOG.debug("Invalid correlation ID, generating new one");
            return UUID.randomUUID().toString();
        }
        return trimmed;
    }

    @Nullable
    private String extractClientIp(@NonNull ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst(HEADER_FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String firstIp = forwardedFor.split(",")[0].trim();
            if (IP_ADDRESS_PATTERN.matcher(firstIp).matches()) {
                return firstIp;
            }
            AUDIT_LOG.debug("Invalid IP in X-Forwarded-For header, falling back to remote address");
        }

        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return null;
    }
}
