package com.truledgr.backend.modules.auth.application;

import com.truledgr.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthFailure failure;

    public AuthException(AuthFailure failure) {
        this(failure, failure.message());
    }

    public AuthException(AuthFailure failure, String detail) {
        super(failure.status(), failure.name(), detail);
        this.failure = failure;
    }

    public AuthFailure getFailure() {
        return failure;
    }
}
