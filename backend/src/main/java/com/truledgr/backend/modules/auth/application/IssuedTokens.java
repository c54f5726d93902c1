package com.truledgr.backend.modules.auth.application;

/**
 * Token pair handed out when a session starts, together with the record it is bound to.
 */
public record IssuedTokens<S>(String accessToken, String refreshToken, long expiresIn, S session) {
}
