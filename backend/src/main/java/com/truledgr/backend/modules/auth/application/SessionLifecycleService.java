package com.truledgr.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.truledgr.backend.modules.auth.application.TokenCodec.InvalidTokenException;
import com.truledgr.backend.modules.auth.domain.RegularSession;
import com.truledgr.backend.modules.auth.domain.TokenUse;
import com.truledgr.backend.modules.auth.infrastructure.persistence.SessionStore;
import com.truledgr.backend.modules.auth.presentation.dto.SessionInfoResponse;
import com.truledgr.backend.modules.user.domain.LedgerUser;
import com.truledgr.backend.modules.user.infrastructure.persistence.LedgerUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class SessionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_REVOKED = "REVOKED";
    static final String REASON_REVOKE_ALL = "REVOKE_ALL";

    private final LedgerUserRepository ledgerUserRepository;
    private final SessionStore sessionStore;
    private final TokenCodec tokenCodec;
    private final ImpersonationService impersonationService;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;

    public SessionLifecycleService(
            LedgerUserRepository ledgerUserRepository,
            SessionStore sessionStore,
            TokenCodec tokenCodec,
            ImpersonationService impersonationService,
            PasswordEncoder passwordEncoder,
            Clock clock,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis
    ) {
        this.ledgerUserRepository = ledgerUserRepository;
        this.sessionStore = sessionStore;
        this.tokenCodec = tokenCodec;
        this.impersonationService = impersonationService;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.accessTokenTtl = Duration.ofMillis(accessTokenTtlMillis);
        this.refreshTokenTtl = Duration.ofMillis(refreshTokenTtlMillis);
    }

    public IssuedTokens<RegularSession> login(String username, String password, ClientInfo client) {
        LedgerUser user = ledgerUserRepository.findByUsernameIgnoreCase(username)
                .orElseThrow(() -> new AuthException(AuthFailure.INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw new AuthException(AuthFailure.INVALID_CREDENTIALS);
        }
        return createSession(user, client);
    }

    /**
     * Opens a regular session for an already authenticated user and issues its token pair.
     */
    public IssuedTokens<RegularSession> createSession(LedgerUser user, ClientInfo client) {
        if (!user.isActive()) {
            throw new AuthException(AuthFailure.INACTIVE_USER);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        RegularSession session = new RegularSession();
        session.setUserId(user.getId());
        session.setRefreshTokenId(UUID.randomUUID().toString());
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(refreshTokenTtl));
        session.setIpAddress(client.ipAddress());
        session.setUserAgent(client.userAgent());
        RegularSession saved = sessionStore.putRegular(session);

        Instant issuedAt = now.toInstant();
        Instant accessExpiry = earliest(issuedAt.plus(accessTokenTtl), saved.getExpiresAt().toInstant());
        String accessToken = tokenCodec.encode(TokenClaims.regularAccess(user.getId(), saved.getId(), issuedAt, accessExpiry));
        String refreshToken = tokenCodec.encode(TokenClaims.regularRefresh(
                user.getId(),
                saved.getId(),
                saved.getRefreshTokenId(),
                issuedAt,
                saved.getExpiresAt().toInstant()
        ));

        log.info("Opened session {} for user {}", saved.getId(), user.getId());
        return new IssuedTokens<>(accessToken, refreshToken, secondsBetween(issuedAt, accessExpiry), saved);
    }

    /**
     * Exchanges a refresh token for a new access token. The refresh token itself is not rotated.
     * Impersonation refresh tokens are handed to {@link ImpersonationService}.
     */
    public RefreshedAccess refresh(String refreshToken) {
        TokenClaims claims;
        try {
            claims = tokenCodec.decode(refreshToken);
        } catch (InvalidTokenException ex) {
            throw new AuthException(AuthFailure.INVALID_TOKEN);
        }
        if (claims.use() != TokenUse.REFRESH) {
            throw new AuthException(AuthFailure.INVALID_TOKEN);
        }
        if (claims.isImpersonation()) {
            return impersonationService.refresh(claims);
        }

        RegularSession session = sessionStore.getRegular(claims.sessionId())
                .filter(found -> found.getUserId().equals(claims.subjectId()))
                .filter(found -> found.getRefreshTokenId().equals(claims.refreshTokenId()))
                .orElseThrow(() -> new AuthException(AuthFailure.INVALID_TOKEN));

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.isRevoked()) {
            throw new AuthException(AuthFailure.SESSION_REVOKED);
        }
        if (session.isExpiredAt(now)) {
            throw new AuthException(AuthFailure.SESSION_EXPIRED);
        }

        boolean userActive = ledgerUserRepository.findById(session.getUserId())
                .map(LedgerUser::isActive)
                .orElse(false);
        if (!userActive) {
            throw new AuthException(AuthFailure.INACTIVE_USER);
        }

        Instant issuedAt = now.toInstant();
        Instant accessExpiry = earliest(issuedAt.plus(accessTokenTtl), session.getExpiresAt().toInstant());
        String accessToken = tokenCodec.encode(TokenClaims.regularAccess(session.getUserId(), session.getId(), issuedAt, accessExpiry));
        return new RefreshedAccess(accessToken, secondsBetween(issuedAt, accessExpiry), session.getUserId());
    }

    /**
     * Marks a session revoked. Revoking an already revoked session succeeds without changes.
     */
    public void revoke(UUID sessionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        sessionStore.updateRegular(sessionId, session -> {
                    session.revoke(now, REASON_REVOKED);
                    return session;
                })
                .orElseThrow(() -> new AuthException(AuthFailure.NOT_FOUND));
        log.info("Revoked session {}", sessionId);
    }

    /**
     * Revokes one of the caller's own sessions. Sessions of other users are reported as not found.
     */
    public void revokeOwned(UUID userId, UUID sessionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean owned = sessionStore.updateRegular(sessionId, session -> {
                    if (!session.getUserId().equals(userId)) {
                        return false;
                    }
                    session.revoke(now, REASON_REVOKED);
                    return true;
                })
                .orElse(false);
        if (!owned) {
            throw new AuthException(AuthFailure.NOT_FOUND);
        }
        log.info("User {} revoked session {}", userId, sessionId);
    }

    /**
     * Ends whatever session backs the caller's current token.
     */
    public void logout(ResolvedIdentity identity) {
        if (identity.impersonating()) {
            impersonationService.end(identity.impersonation().adminUserId(), identity.impersonation().sessionId());
            return;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        sessionStore.updateRegular(identity.regularSessionId(), session -> {
                    session.revoke(now, REASON_LOGOUT);
                    return session;
                })
                .orElseThrow(() -> new AuthException(AuthFailure.NOT_FOUND));
        log.info("User {} logged out of session {}", identity.userId(), identity.regularSessionId());
    }

    public int revokeAll(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int revoked = 0;
        for (RegularSession session : sessionStore.findRegularByOwner(userId)) {
            if (!session.isValidAt(now)) {
                continue;
            }
            boolean changed = sessionStore.updateRegular(session.getId(), locked -> {
                        if (locked.isRevoked()) {
                            return false;
                        }
                        locked.revoke(now, REASON_REVOKE_ALL);
                        return true;
                    })
                    .orElse(false);
            if (changed) {
                revoked++;
            }
        }
        log.info("User {} revoked {} sessions", userId, revoked);
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<SessionInfoResponse> listActiveSessions(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return sessionStore.findRegularByOwner(userId).stream()
                .filter(session -> session.isValidAt(now))
                .map(session -> SessionInfoResponse.from(session, now))
                .toList();
    }

    private static Instant earliest(Instant first, Instant second) {
        return first.isBefore(second) ? first : second;
    }

    private static long secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).getSeconds();
    }
}
