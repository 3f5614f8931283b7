package com.fulqrom.backend.modules.access.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;

import com.fulqrom.backend.modules.access.infrastructure.jwt.AccessTokenKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.stereotype.Service;

/**
 * Verifies HS256 access tokens minted by the identity provider. The subject is the caller's user identifier.
 */
@Service
public class AccessTokenService {

    private final AccessTokenKeyProvider keyProvider;
    private final Clock clock;

    public AccessTokenService(AccessTokenKeyProvider keyProvider, Clock clock) {
        this.keyProvider = keyProvider;
        this.clock = clock;
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                throw new InvalidTokenException("Access token has no subject", null);
            }
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : clock.instant();
            return new ParsedToken(
                    subject,
                    claims.get("email", String.class),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(String subject, String email, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
