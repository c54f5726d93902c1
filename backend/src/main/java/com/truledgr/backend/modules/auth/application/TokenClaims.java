package com.truledgr.backend.modules.auth.application;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import com.truledgr.backend.modules.auth.domain.TokenKind;
import com.truledgr.backend.modules.auth.domain.TokenUse;

/**
 * Claim set carried by a session token.
 *
 * <p>Regular tokens reference the {@code RegularSession} through {@code sessionId}; regular refresh
 * tokens also carry that session's refresh credential id. Impersonation tokens carry the target as
 * subject plus the administrator id and the impersonation session id.
 */
public record TokenClaims(
        UUID subjectId,
        TokenKind kind,
        TokenUse use,
        Instant issuedAt,
        Instant expiresAt,
        UUID sessionId,
        String refreshTokenId,
        UUID adminId,
        UUID impersonationSessionId
) {

    public TokenClaims {
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(use, "use is required");
        Objects.requireNonNull(issuedAt, "issuedAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        if (kind == TokenKind.REGULAR) {
            require(sessionId != null, "regular tokens need a session id");
            require(adminId == null && impersonationSessionId == null, "regular tokens cannot carry impersonation claims");
            require(use == TokenUse.ACCESS || refreshTokenId != null, "regular refresh tokens need a refresh token id");
        } else {
            require(adminId != null && impersonationSessionId != null, "impersonation tokens need admin and session ids");
            require(sessionId == null && refreshTokenId == null, "impersonation tokens cannot carry regular session claims");
        }
    }

    public static TokenClaims regularAccess(UUID userId, UUID sessionId, Instant issuedAt, Instant expiresAt) {
        return new TokenClaims(userId, TokenKind.REGULAR, TokenUse.ACCESS, issuedAt, expiresAt, sessionId, null, null, null);
    }

    public static TokenClaims regularRefresh(UUID userId, UUID sessionId, String refreshTokenId, Instant issuedAt, Instant expiresAt) {
        return new TokenClaims(userId, TokenKind.REGULAR, TokenUse.REFRESH, issuedAt, expiresAt, sessionId, refreshTokenId, null, null);
    }

    public static TokenClaims impersonation(
            TokenUse use,
            UUID targetUserId,
            UUID adminId,
            UUID impersonationSessionId,
            Instant issuedAt,
            Instant expiresAt
    ) {
        return new TokenClaims(targetUserId, TokenKind.IMPERSONATION, use, issuedAt, expiresAt, null, null, adminId, impersonationSessionId);
    }

    public boolean isImpersonation() {
        return kind == TokenKind.IMPERSONATION;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
