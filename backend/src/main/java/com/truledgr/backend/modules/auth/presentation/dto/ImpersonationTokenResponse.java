package com.truledgr.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.truledgr.backend.modules.auth.application.IssuedTokens;
import com.truledgr.backend.modules.auth.domain.ImpersonationSession;

public record ImpersonationTokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        UUID targetUserId,
        UUID adminUserId,
        UUID impersonationSessionId
) {

    public static ImpersonationTokenResponse from(IssuedTokens<ImpersonationSession> issued) {
        ImpersonationSession session = issued.session();
        return new ImpersonationTokenResponse(
                issued.accessToken(),
                issued.refreshToken(),
                TokenResponse.DEFAULT_TOKEN_TYPE,
                issued.expiresIn(),
                session.getTargetUserId(),
                session.getAdminUserId(),
                session.getId()
        );
    }
}
