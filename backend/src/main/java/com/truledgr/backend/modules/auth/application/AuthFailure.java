package com.truledgr.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Expected failure kinds of the session and impersonation core, with the HTTP status and
 * human message each one surfaces as.
 */
public enum AuthFailure {
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Token is invalid or expired"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Incorrect username or password"),
    INACTIVE_USER(HttpStatus.FORBIDDEN, "User account is inactive"),
    SESSION_EXPIRED(HttpStatus.UNAUTHORIZED, "Session expired"),
    SESSION_REVOKED(HttpStatus.UNAUTHORIZED, "Session has been revoked"),
    ADMIN_REQUIRED(HttpStatus.FORBIDDEN, "Administrator privileges are required"),
    SELF_IMPERSONATION_FORBIDDEN(HttpStatus.FORBIDDEN, "Administrators cannot impersonate themselves"),
    TARGET_USER_INACTIVE(HttpStatus.NOT_FOUND, "Target user not found or inactive"),
    REASON_REQUIRED(HttpStatus.BAD_REQUEST, "A reason is required to impersonate a user"),
    REASON_TOO_LONG(HttpStatus.BAD_REQUEST, "Impersonation reason must be at most 500 characters"),
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN, "Only the initiating administrator can end this impersonation session"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Session not found"),
    // Resolver path: never says whether the token was malformed, expired or revoked
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Could not validate credentials");

    private final HttpStatus status;
    private final String message;

    AuthFailure(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus status() {
        return status;
    }

    public String message() {
        return message;
    }
}
