package com.fulqrom.backend.global.security;

import java.io.IOException;

import com.fulqrom.backend.global.error.ProblemResponse;
import com.fulqrom.backend.modules.access.application.AuthorizationFailure;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Writes the same 401 body the request gate produces, whether the token was rejected or missing.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(RestAuthenticationEntryPoint.class);
    private static final AuthorizationFailure FAILURE = AuthorizationFailure.AUTHENTICATION_REQUIRED;

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        log.debug("Authentication failed on {} {}: {}", request.getMethod(), request.getRequestURI(), authException.getMessage());

        ProblemResponse body = ProblemResponse.of(
                FAILURE.status(), FAILURE.code(), FAILURE.defaultDetail(), request.getRequestURI());
        response.setStatus(FAILURE.status().value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), body);
    }
}
