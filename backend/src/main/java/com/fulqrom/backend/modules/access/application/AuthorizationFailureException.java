package com.fulqrom.backend.modules.access.application;

import com.fulqrom.backend.global.error.ProblemException;

public class AuthorizationFailureException extends ProblemException {

    private final AuthorizationFailure failure;

    public AuthorizationFailureException(AuthorizationFailure failure) {
        this(failure, failure.defaultDetail());
    }

    public AuthorizationFailureException(AuthorizationFailure failure, String detail) {
        super(failure.status(), failure.code(), detail);
        this.failure = failure;
    }

    public AuthorizationFailure getFailure() {
        return failure;
    }
}
