package com.fulqrom.backend.global.security;

/**
 * Authenticated caller as carried by the access token. {@code subject} is the user identifier handed to the
 * identity resolver: a user id, an identity-provider subject or a custom account id.
 */
public record JwtAuthenticationPrincipal(String subject, String email) {
}
