package com.fulqrom.backend.modules.access.application;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Evaluator that produced the verdict.
 */
public enum DecisionSource {
    RESOURCE_ACCESS("resource_access"),
    ROLE("role"),
    DENIED("denied");

    private final String value;

    DecisionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
