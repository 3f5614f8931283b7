package com.fulqrom.backend.support;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import com.fulqrom.backend.modules.access.infrastructure.jwt.AccessTokenKeyProvider;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

/**
 * Mints access tokens the way the identity provider does, for tests only.
 */
public final class TestAccessTokens {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(15);

    private TestAccessTokens() {
    }

    public static String issue(AccessTokenKeyProvider keyProvider, String subject, String email, Instant issuedAt) {
        return issue(keyProvider, subject, email, issuedAt, DEFAULT_TTL);
    }

    public static String issue(
            AccessTokenKeyProvider keyProvider,
            String subject,
            String email,
            Instant issuedAt,
            Duration ttl
    ) {
        return Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plus(ttl)))
                .claim("email", email)
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();
    }
}
