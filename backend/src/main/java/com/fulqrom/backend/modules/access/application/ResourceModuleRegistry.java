package com.fulqrom.backend.modules.access.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fulqrom.backend.modules.access.config.AuthorizationProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resource type to role module lookup. Types missing from the table map to their plural form,
 * so a {@code parking_bay} is covered by the {@code parking_bays} module.
 */
@Component
public class ResourceModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResourceModuleRegistry.class);

    static final Map<String, String> DEFAULT_MODULES;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("org", "org");
        defaults.put("site", "sites");
        defaults.put("building", "buildings");
        defaults.put("floor", "floors");
        defaults.put("tenant", "tenants");
        defaults.put("document", "documents");
        defaults.put("asset", "assets");
        defaults.put("vendor", "vendors");
        defaults.put("customer", "customers");
        defaults.put("user", "users");
        defaults.put("analytics", "analytics");
        DEFAULT_MODULES = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, String> modules;

    public ResourceModuleRegistry(AuthorizationProperties properties) {
        Map<String, String> merged = new LinkedHashMap<>(DEFAULT_MODULES);
        merged.putAll(properties.getResourceModules());
        this.modules = Collections.unmodifiableMap(merged);
        log.debug("Resource module mapping: {}", this.modules);
    }

    public Optional<String> moduleFor(String resourceType) {
        if (resourceType == null || resourceType.isBlank()) {
            return Optional.empty();
        }
        String mapped = modules.get(resourceType);
        return Optional.of(mapped != null ? mapped : resourceType + "s");
    }

    public Set<String> resourceTypes() {
        return modules.keySet();
    }
}
