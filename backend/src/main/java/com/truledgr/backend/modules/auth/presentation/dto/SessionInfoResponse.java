package com.truledgr.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.truledgr.backend.modules.auth.domain.RegularSession;

public record SessionInfoResponse(
        UUID id,
        UUID userId,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        String ipAddress,
        String userAgent
) {

    public static SessionInfoResponse from(RegularSession session, OffsetDateTime now) {
        String status;
        if (session.isRevoked()) {
            status = "revoked";
        } else if (session.isExpiredAt(now)) {
            status = "expired";
        } else {
            status = "active";
        }
        return new SessionInfoResponse(
                session.getId(),
                session.getUserId(),
                status,
                session.getIssuedAt(),
                session.getExpiresAt(),
                session.getIpAddress(),
                session.getUserAgent()
        );
    }
}
