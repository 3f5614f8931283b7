package com.fulqrom.backend.modules.access.application;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds that are not authorization denials. Each maps to its own response.
 */
public enum AuthorizationFailure {
    AUTHENTICATION_REQUIRED(HttpStatus.UNAUTHORIZED, "authz.authentication_required", "Authentication required."),
    RESOURCE_ID_MISSING(HttpStatus.BAD_REQUEST, "authz.resource_id_missing", "Resource ID not provided in request."),
    RESOURCE_TYPE_MISSING(HttpStatus.BAD_REQUEST, "authz.resource_type_missing", "Resource type not provided in request."),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "authz.user_not_found", "User not found in system."),
    ACCOUNT_INACTIVE(HttpStatus.FORBIDDEN, "authz.account_inactive", "User account is inactive. Please contact administrator."),
    INVALID_ACTION(HttpStatus.BAD_REQUEST, "authz.invalid_action", "Invalid action. Must be one of: view, create, edit, delete.");

    private final HttpStatus status;
    private final String code;
    private final String defaultDetail;

    AuthorizationFailure(HttpStatus status, String code, String defaultDetail) {
        this.status = status;
        this.code = code;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }

    public String defaultDetail() {
        return defaultDetail;
    }
}
