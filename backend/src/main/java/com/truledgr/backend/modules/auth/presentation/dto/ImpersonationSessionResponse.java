package com.truledgr.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.truledgr.backend.modules.auth.domain.ImpersonationStatus;

/**
 * One row of an administrator's impersonation history. Usernames are joined in at read time.
 */
public record ImpersonationSessionResponse(
        UUID id,
        UUID adminUserId,
        String adminUsername,
        UUID targetUserId,
        String targetUsername,
        String reason,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        OffsetDateTime endedAt,
        ImpersonationStatus status
) {
}
