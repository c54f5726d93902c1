package com.truledgr.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record TokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        UUID userId
) {
    public static final String DEFAULT_TOKEN_TYPE = "bearer";

    public static TokenResponse bearer(String accessToken, String refreshToken, long expiresIn, UUID userId) {
        return new TokenResponse(accessToken, refreshToken, DEFAULT_TOKEN_TYPE, expiresIn, userId);
    }
}
