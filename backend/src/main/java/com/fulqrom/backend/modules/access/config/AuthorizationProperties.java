package com.fulqrom.backend.modules.access.config;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the permission gate under {@code app.authorization}.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "app.authorization")
public class AuthorizationProperties {

    /**
     * Header consulted when the request carries no authenticated principal.
     */
    @NotBlank
    private String userIdHeader = "X-User-Id";

    /**
     * Query or form parameter consulted after the header.
     */
    @NotBlank
    private String userIdParameter = "requester_id";

    /**
     * Extra or overriding resource-type to module-name entries.
     */
    private Map<String, String> resourceModules = new LinkedHashMap<>();

    public String getUserIdHeader() {
        return userIdHeader;
    }

    public void setUserIdHeader(String userIdHeader) {
        this.userIdHeader = userIdHeader;
    }

    public String getUserIdParameter() {
        return userIdParameter;
    }

    public void setUserIdParameter(String userIdParameter) {
        this.userIdParameter = userIdParameter;
    }

    public Map<String, String> getResourceModules() {
        return resourceModules;
    }

    public void setResourceModules(Map<String, String> resourceModules) {
        this.resourceModules = resourceModules;
    }
}
