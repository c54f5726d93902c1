package com.truledgr.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Whether a token is presented as a bearer credential or exchanged for a new access token.
 */
public enum TokenUse {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenUse(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenUse> fromClaim(String value) {
        return Arrays.stream(values())
                .filter(use -> use.claimValue.equals(value))
                .findFirst();
    }
}
