package com.fulqrom.backend.modules.access.presentation.gate;

import java.util.Optional;

import com.fulqrom.backend.global.security.SecurityUtils;
import com.fulqrom.backend.modules.access.config.AuthorizationProperties;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Picks the caller's user identifier once per request: authenticated principal, then the configured header,
 * then the configured query/form parameter.
 */
@Component
public class UserIdentifierExtractor {

    private final AuthorizationProperties properties;

    public UserIdentifierExtractor(AuthorizationProperties properties) {
        this.properties = properties;
    }

    public Optional<String> extract(HttpServletRequest request) {
        Optional<String> fromPrincipal = SecurityUtils.findCurrentSubject();
        if (fromPrincipal.isPresent()) {
            return fromPrincipal;
        }
        String header = request.getHeader(properties.getUserIdHeader());
        if (StringUtils.hasText(header)) {
            return Optional.of(header.trim());
        }
        String parameter = request.getParameter(properties.getUserIdParameter());
        if (StringUtils.hasText(parameter)) {
            return Optional.of(parameter.trim());
        }
        return Optional.empty();
    }
}
