package com.truledgr.backend.modules.auth.application;

/**
 * Where a session was opened from, kept on the session row for the owner's session list
 * and the impersonation audit trail.
 */
public record ClientInfo(String ipAddress, String userAgent) {

    private static final int IP_ADDRESS_MAX_LENGTH = 64;
    private static final int USER_AGENT_MAX_LENGTH = 255;

    public static final ClientInfo UNKNOWN = new ClientInfo(null, null);

    public static ClientInfo of(String rawIpAddress, String rawUserAgent) {
        return new ClientInfo(
                normalize(rawIpAddress, IP_ADDRESS_MAX_LENGTH),
                normalize(rawUserAgent, USER_AGENT_MAX_LENGTH)
        );
    }

    private static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
