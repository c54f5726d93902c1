package com.truledgr.backend.modules.auth.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ImpersonationStatus {
    ACTIVE("active"),
    EXPIRED("expired"),
    REVOKED("revoked");

    private final String value;

    ImpersonationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
