package com.example.authz.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "app.authz")
public record AuthzProperties(
        @DefaultValue("true") boolean enabled,
        JwtProperties jwt,
        List<String> storeIdParams,
        List<String> publicPaths,
        AuditProperties audit
) {
    public AuthzProperties {
        if (jwt == null) {
            jwt = new JwtProperties(null, null, Duration.ofSeconds(60), "permissions");
        }
        if (storeIdParams == null || storeIdParams.isEmpty()) {
            storeIdParams = List.of("storeId", "id", "store_id");
        }
        if (publicPaths == null) {
            publicPaths = List.of();
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
    }

    /**
     * @param secret           HS256 signing key, at least 32 bytes
     * @param issuer           expected {@code iss}; not checked when blank
     * @param clockSkew        tolerance applied to {@code exp} and {@code nbf}
     * @param permissionsClaim claim carrying granted {@code resource:action} scopes
     */
    public record JwtProperties(
            String secret,
            String issuer,
            Duration clockSkew,
            String permissionsClaim
    ) {
        public JwtProperties {
            if (clockSkew == null) {
                clockSkew = Duration.ofSeconds(60);
            }
            if (permissionsClaim == null || permissionsClaim.isBlank()) {
                permissionsClaim = "permissions";
            }
        }
    }

    public record AuditProperties(
            @DefaultValue("true") boolean enabled
    ) {}
}
