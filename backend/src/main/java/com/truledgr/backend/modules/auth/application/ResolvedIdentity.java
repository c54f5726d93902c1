package com.truledgr.backend.modules.auth.application;

import java.util.UUID;

/**
 * Effective acting identity behind a bearer token. When impersonating, the user fields
 * describe the target and {@link #impersonation()} links back to the administrator;
 * permissions always follow the user fields.
 */
public record ResolvedIdentity(
        UUID userId,
        String username,
        String email,
        boolean admin,
        UUID regularSessionId,
        ImpersonationContext impersonation
) {

    public boolean impersonating() {
        return impersonation != null;
    }

    public record ImpersonationContext(UUID adminUserId, String adminUsername, UUID sessionId, String reason) {
    }
}
