package com.truledgr.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.truledgr.backend.modules.auth.application.ResolvedIdentity;

public record WhoAmIResponse(
        UUID userId,
        String username,
        String email,
        @JsonProperty("is_admin") boolean admin,
        @JsonProperty("is_impersonating") boolean impersonating,
        @JsonInclude(JsonInclude.Include.NON_NULL) Impersonation impersonation
) {

    public static WhoAmIResponse from(ResolvedIdentity identity) {
        Impersonation impersonation = null;
        if (identity.impersonating()) {
            ResolvedIdentity.ImpersonationContext context = identity.impersonation();
            impersonation = new Impersonation(
                    context.adminUserId(),
                    context.adminUsername(),
                    context.sessionId(),
                    context.reason()
            );
        }
        return new WhoAmIResponse(
                identity.userId(),
                identity.username(),
                identity.email(),
                identity.admin(),
                identity.impersonating(),
                impersonation
        );
    }

    public record Impersonation(UUID adminUserId, String adminUsername, UUID sessionId, String reason) {
    }
}
