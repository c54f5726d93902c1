package com.truledgr.backend.global.security;

import java.util.UUID;

import com.truledgr.backend.modules.auth.application.AuthException;
import com.truledgr.backend.modules.auth.application.AuthFailure;
import com.truledgr.backend.modules.auth.application.ResolvedIdentity;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static ResolvedIdentity getCurrentIdentity() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof ResolvedIdentity identity)) {
            throw new AuthException(AuthFailure.UNAUTHORIZED);
        }
        return identity;
    }

    public static UUID getCurrentUserId() {
        return getCurrentIdentity().userId();
    }
}
