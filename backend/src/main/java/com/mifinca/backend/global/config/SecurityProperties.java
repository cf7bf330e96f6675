package com.mifinca.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credential settings, bound once at startup and injected where tokens are signed or verified.
 *
 * @param jwtSecret HMAC secret, Base64 or raw text
 * @param accessTokenTtl lifetime of an issued access token
 * @param issuer value written to the {@code iss} claim and required on parse
 */
@ConfigurationProperties(prefix = "mifinca.security")
public record SecurityProperties(
        String jwtSecret,
        Duration accessTokenTtl,
        String issuer
) {

    private static final int MIN_SECRET_LENGTH = 32;

    public SecurityProperties {
        if (jwtSecret == null || jwtSecret.isBlank()) {
            throw new IllegalStateException("mifinca.security.jwt-secret must be configured");
        }
        if (jwtSecret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException("mifinca.security.jwt-secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        if (accessTokenTtl == null) {
            accessTokenTtl = Duration.ofMinutes(30);
        }
        if (accessTokenTtl.isNegative() || accessTokenTtl.isZero()) {
            throw new IllegalStateException("mifinca.security.access-token-ttl must be positive");
        }
        if (issuer == null || issuer.isBlank()) {
            issuer = "mifinca";
        }
    }
}
