package com.mifinca.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.mifinca.backend.global.config.SecurityProperties;
import com.mifinca.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.mifinca.backend.modules.auth.presentation.dto.TokenResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

/**
 * Issues and validates the signed bearer token. The only identity claim that matters downstream is {@code sub}.
 */
@Service
public class JwtTokenService {

    private static final String EMAIL_CLAIM = "email";

    private final JwtTokenProvider tokenProvider;
    private final SecurityProperties securityProperties;
    private final Clock clock;

    public JwtTokenService(JwtTokenProvider tokenProvider, SecurityProperties securityProperties, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.securityProperties = securityProperties;
        this.clock = clock;
    }

    public TokenResponse issueAccessToken(UUID userId, String email) {
        Instant now = clock.instant();
        Instant expiry = now.plus(securityProperties.accessTokenTtl());
        SecretKey key = tokenProvider.getSecretKey();

        String accessToken = Jwts.builder()
                .subject(userId.toString())
                .issuer(securityProperties.issuer())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(EMAIL_CLAIM, email)
                .signWith(key, SIG.HS256)
                .compact();

        return new TokenResponse(
                accessToken,
                TokenResponse.DEFAULT_TOKEN_TYPE,
                securityProperties.accessTokenTtl().toSeconds(),
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .requireIssuer(securityProperties.issuer())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getSubject() == null) {
                throw new InvalidTokenException("Access token has no subject", null);
            }
            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get(EMAIL_CLAIM, String.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    email,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, String email, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
