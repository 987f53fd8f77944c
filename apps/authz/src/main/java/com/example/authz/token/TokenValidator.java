package com.example.authz.token;

import com.example.authz.adapter.RoleAdapters;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.exception.AuthenticationException;
import com.example.authz.model.DenialReason;
import com.example.authz.model.PermissionScope;
import com.example.authz.model.Principal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a bearer credential into an active {@link Principal}.
 *
 * <p>The token contributes identity ({@code sub}, {@code email}) and granted
 * permission scopes only. Site-admin status and store roles are never read from
 * it. Errors are always {@link AuthenticationException}.
 */
@Slf4j
public class TokenValidator {

    public static final String DEFAULT_PERMISSIONS_CLAIM = "permissions";

    private final ReactiveJwtDecoder jwtDecoder;
    private final RoleAdapters roleAdapters;
    private final String permissionsClaim;

    public TokenValidator(ReactiveJwtDecoder jwtDecoder, RoleAdapters roleAdapters, String permissionsClaim) {
        this.jwtDecoder = jwtDecoder;
        this.roleAdapters = roleAdapters;
        this.permissionsClaim = permissionsClaim != null ? permissionsClaim : DEFAULT_PERMISSIONS_CLAIM;
    }

    public Mono<Principal> authenticate(String rawCredential) {
        Optional<String> token = BearerTokenExtractor.extract(rawCredential);
        if (token.isEmpty()) {
            return Mono.error(new AuthenticationException(
                    DenialReason.MISSING_CREDENTIAL, "No bearer credential presented"));
        }

        return Mono.defer(() -> jwtDecoder.decode(token.get()))
                .onErrorMap(e -> {
                    if (e instanceof JwtException) {
                        log.debug("Token rejected: {}", StringSanitizer.forLog(e.getMessage(), 200));
                    } else {
                        log.warn("Token decoding failed: {}", StringSanitizer.forLog(e.getMessage(), 200));
                    }
                    return new AuthenticationException(DenialReason.INVALID_CREDENTIAL, "Invalid token", e);
                })
                .map(this::toPrincipal)
                .flatMap(this::requireActive);
    }

    private Principal toPrincipal(Jwt jwt) {
        String subject = jwt.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new AuthenticationException(DenialReason.INVALID_CREDENTIAL, "Token has no subject");
        }
        return Principal.authenticated(subject, jwt.getClaimAsString("email"), grantedScopes(jwt));
    }

    private Mono<Principal> requireActive(Principal principal) {
        return roleAdapters.isUserActive(principal.id())
                .onErrorMap(e -> {
                    log.error("Account status lookup failed for user {}: {}",
                            StringSanitizer.forLog(principal.id()), e.getMessage());
                    return new AuthenticationException(DenialReason.ACCOUNT_STATUS_UNAVAILABLE,
                            "Account status unavailable", e);
                })
                .flatMap(active -> {
                    if (!active) {
                        log.warn("Token presented for inactive account {}", StringSanitizer.forLog(principal.id()));
                        return Mono.error(new AuthenticationException(
                                DenialReason.ACCOUNT_INACTIVE, "Account inactive"));
                    }
                    return Mono.just(principal);
                });
    }

    private Set<PermissionScope> grantedScopes(Jwt jwt) {
        Object claim = jwt.getClaims().get(permissionsClaim);
        if (claim == null) {
            return Set.of();
        }

        List<String> values = new ArrayList<>();
        if (claim instanceof Collection<?> collection) {
            collection.forEach(value -> values.add(String.valueOf(value)));
        } else {
            for (String value : claim.toString().split("[\\s,]+")) {
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        }

        Set<PermissionScope> scopes = new LinkedHashSet<>();
        for (String value : values) {
            Optional<PermissionScope> scope = PermissionScope.tryParse(value.trim());
            if (scope.isPresent()) {
                scopes.add(scope.get());
            } else {
                log.debug("Dropping unknown permission scope '{}'", StringSanitizer.forLog(value));
            }
        }
        return scopes;
    }
}
