package com.truledgr.backend.modules.auth.presentation.dto;

import java.util.UUID;

/**
 * Carries no bean constraints. The service checks the caller's admin flag before either field,
 * so a missing target or an over-long reason never masks ADMIN_REQUIRED.
 */
public record StartImpersonationRequest(
        UUID targetUserId,
        String reason
) {
}
