package com.fulqrom.backend.modules.access.presentation.gate;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Map;
import java.util.Optional;

import com.fulqrom.backend.modules.access.application.ActionNormalizer;
import com.fulqrom.backend.modules.access.application.AuthorizationDecision;
import com.fulqrom.backend.modules.access.application.AuthorizationFailure;
import com.fulqrom.backend.modules.access.application.AuthorizationFailureException;
import com.fulqrom.backend.modules.access.application.AuthorizationService;
import com.fulqrom.backend.modules.access.application.PermissionDeniedException;

import jakarta.servlet.http.HttpServletRequest;

import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Enforces {@link RequireResourcePermission} and {@link RequireModulePermission} before the handler runs.
 * Denials become {@link PermissionDeniedException}; granted decisions are kept in {@link AuthorizationContext}.
 */
@Aspect
@Component
public class PermissionAspect {

    private static final Logger log = LoggerFactory.getLogger(PermissionAspect.class);

    private final AuthorizationService authorizationService;
    private final UserIdentifierExtractor userIdentifierExtractor;

    public PermissionAspect(AuthorizationService authorizationService, UserIdentifierExtractor userIdentifierExtractor) {
        this.authorizationService = authorizationService;
        this.userIdentifierExtractor = userIdentifierExtractor;
    }

    @Before("@annotation(requireResourcePermission)")
    public void checkResourcePermission(JoinPoint joinPoint, RequireResourcePermission requireResourcePermission) {
        HttpServletRequest request = currentRequest();
        String userIdentifier = requireIdentifier(request);
        String resourceId = resolveResourceId(joinPoint, request, requireResourcePermission.resourceIdParam())
                .orElseThrow(() -> new AuthorizationFailureException(AuthorizationFailure.RESOURCE_ID_MISSING));

        AuthorizationDecision decision = authorizationService.authorizeResource(
                userIdentifier,
                requireResourcePermission.resourceType(),
                requireResourcePermission.action(),
                resourceId
        );
        enforce(request, decision);
    }

    @Before("@annotation(requireModulePermission)")
    public void checkModulePermission(JoinPoint joinPoint, RequireModulePermission requireModulePermission) {
        HttpServletRequest request = currentRequest();
        String userIdentifier = requireIdentifier(request);
        String action = StringUtils.hasText(requireModulePermission.action())
                ? requireModulePermission.action()
                : ActionNormalizer.fromHttpMethod(request.getMethod()).action();

        AuthorizationDecision decision = authorizationService.authorizeModule(
                userIdentifier,
                requireModulePermission.module(),
                action
        );
        enforce(request, decision);
    }

    private void enforce(HttpServletRequest request, AuthorizationDecision decision) {
        if (!decision.allowed()) {
            log.warn("Access denied on {} {} for user {} (source: {})", request.getMethod(), request.getRequestURI(),
                    decision.userId(), decision.source().value());
            throw new PermissionDeniedException(decision);
        }
        AuthorizationContext.store(request, decision);
    }

    private String requireIdentifier(HttpServletRequest request) {
        return userIdentifierExtractor.extract(request)
                .orElseThrow(() -> new AuthorizationFailureException(AuthorizationFailure.AUTHENTICATION_REQUIRED));
    }

    private Optional<String> resolveResourceId(JoinPoint joinPoint, HttpServletRequest request, String name) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        Parameter[] parameters = method.getParameters();
        Object[] args = joinPoint.getArgs();
        for (int i = 0; i < parameters.length; i++) {
            if (parameters[i].getName().equals(name) && args[i] != null) {
                return nonBlank(args[i].toString());
            }
        }

        Object templateVariables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (templateVariables instanceof Map<?, ?> variables && variables.get(name) != null) {
            return nonBlank(variables.get(name).toString());
        }
        return nonBlank(request.getParameter(name));
    }

    private static Optional<String> nonBlank(String value) {
        return StringUtils.hasText(value) ? Optional.of(value.trim()) : Optional.empty();
    }

    private static HttpServletRequest currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes servletAttributes) {
            return servletAttributes.getRequest();
        }
        throw new IllegalStateException("Permission checks require an active HTTP request");
    }
}
