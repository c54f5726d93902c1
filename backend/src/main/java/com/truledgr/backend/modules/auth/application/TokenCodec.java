package com.truledgr.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import com.truledgr.backend.modules.auth.domain.TokenKind;
import com.truledgr.backend.modules.auth.domain.TokenUse;
import com.truledgr.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

/**
 * Signs and verifies session tokens (HS256 JWT). Stateless apart from the key and clock,
 * so it is safe to share across threads.
 */
@Service
public class TokenCodec {

    static final String CLAIM_KIND = "kind";
    static final String CLAIM_USE = "use";
    static final String CLAIM_SESSION_ID = "sid";
    static final String CLAIM_ADMIN_ID = "admin_id";
    static final String CLAIM_IMPERSONATION_SESSION_ID = "imp_sid";

    private final JwtTokenProvider tokenProvider;
    private final Clock clock;
    private final JwtParser parser;

    public TokenCodec(JwtTokenProvider tokenProvider, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(tokenProvider.getSecretKey())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String encode(TokenClaims claims) {
        JwtBuilder builder = Jwts.builder()
                .subject(claims.subjectId().toString())
                .issuedAt(Date.from(claims.issuedAt()))
                .expiration(Date.from(claims.expiresAt()))
                .claim(CLAIM_KIND, claims.kind().claimValue())
                .claim(CLAIM_USE, claims.use().claimValue());

        if (claims.kind() == TokenKind.REGULAR) {
            builder.claim(CLAIM_SESSION_ID, claims.sessionId().toString());
            if (claims.refreshTokenId() != null) {
                builder.id(claims.refreshTokenId());
            }
        } else {
            builder.claim(CLAIM_ADMIN_ID, claims.adminId().toString())
                    .claim(CLAIM_IMPERSONATION_SESSION_ID, claims.impersonationSessionId().toString());
        }

        return builder.signWith(tokenProvider.getSecretKey(), SIG.HS256).compact();
    }

    /**
     * Verifies signature, structure and expiry. Callers never re-check expiry on the result.
     *
     * @throws InvalidTokenException when any of those checks fails
     */
    public TokenClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty", null);
        }

        TokenClaims parsed;
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            parsed = toTokenClaims(claims);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Token failed verification", e);
        }

        // exp is exclusive: a token is dead at the instant it expires
        if (!clock.instant().isBefore(parsed.expiresAt())) {
            throw new InvalidTokenException("Token expired", null);
        }
        return parsed;
    }

    private TokenClaims toTokenClaims(Claims claims) {
        UUID subjectId = requireUuid(claims.getSubject(), "sub");
        TokenKind kind = TokenKind.fromClaim(claims.get(CLAIM_KIND, String.class))
                .orElseThrow(() -> new IllegalArgumentException("Unknown token kind"));
        TokenUse use = TokenUse.fromClaim(claims.get(CLAIM_USE, String.class))
                .orElseThrow(() -> new IllegalArgumentException("Unknown token use"));
        Instant issuedAt = requireInstant(claims.getIssuedAt(), "iat");
        Instant expiresAt = requireInstant(claims.getExpiration(), "exp");

        if (kind == TokenKind.REGULAR) {
            UUID sessionId = requireUuid(claims.get(CLAIM_SESSION_ID, String.class), CLAIM_SESSION_ID);
            String refreshTokenId = use == TokenUse.REFRESH ? claims.getId() : null;
            return new TokenClaims(subjectId, kind, use, issuedAt, expiresAt, sessionId, refreshTokenId, null, null);
        }

        UUID adminId = requireUuid(claims.get(CLAIM_ADMIN_ID, String.class), CLAIM_ADMIN_ID);
        UUID impersonationSessionId = requireUuid(
                claims.get(CLAIM_IMPERSONATION_SESSION_ID, String.class),
                CLAIM_IMPERSONATION_SESSION_ID
        );
        return TokenClaims.impersonation(use, subjectId, adminId, impersonationSessionId, issuedAt, expiresAt);
    }

    private static UUID requireUuid(String value, String claimName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing claim " + claimName);
        }
        return UUID.fromString(value);
    }

    private static Instant requireInstant(Date value, String claimName) {
        if (value == null) {
            throw new IllegalArgumentException("Missing claim " + claimName);
        }
        return value.toInstant();
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
