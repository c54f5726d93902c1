package com.truledgr.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record EndImpersonationRequest(
        @NotNull(message = "impersonation_session_id is required") UUID impersonationSessionId
) {
}
