package com.truledgr.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.truledgr.backend.modules.auth.domain.ImpersonationSession;
import com.truledgr.backend.modules.auth.domain.ImpersonationStatus;
import com.truledgr.backend.modules.auth.domain.TokenUse;
import com.truledgr.backend.modules.auth.infrastructure.persistence.SessionStore;
import com.truledgr.backend.modules.auth.presentation.dto.ImpersonationSessionResponse;
import com.truledgr.backend.modules.user.domain.LedgerUser;
import com.truledgr.backend.modules.user.infrastructure.persistence.LedgerUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Starts, refreshes, lists and ends impersonation sessions.
 *
 * <p>An impersonation session lives for a fixed duration from its start. Tokens minted for it
 * name the target as subject and never outlive the session. Expiry is judged against the clock
 * whenever a session is read; the stored status is not rewritten on read.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class ImpersonationService {

    private static final Logger log = LoggerFactory.getLogger(ImpersonationService.class);

    static final int MAX_REASON_LENGTH = 500;

    private enum EndOutcome { ENDED, ALREADY_TERMINAL, NOT_OWNER }

    private final LedgerUserRepository ledgerUserRepository;
    private final SessionStore sessionStore;
    private final TokenCodec tokenCodec;
    private final Clock clock;
    private final Duration accessTokenTtl;
    private final Duration sessionDuration;

    public ImpersonationService(
            LedgerUserRepository ledgerUserRepository,
            SessionStore sessionStore,
            TokenCodec tokenCodec,
            Clock clock,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${app.auth.impersonation.duration:PT2H}") Duration sessionDuration
    ) {
        this.ledgerUserRepository = ledgerUserRepository;
        this.sessionStore = sessionStore;
        this.tokenCodec = tokenCodec;
        this.clock = clock;
        this.accessTokenTtl = Duration.ofMillis(accessTokenTtlMillis);
        this.sessionDuration = sessionDuration;
    }

    /**
     * Preconditions are checked in order and the first failure wins: admin flag, distinct target,
     * active target, non-blank reason of bounded length.
     */
    public IssuedTokens<ImpersonationSession> start(UUID adminUserId, UUID targetUserId, String reason, ClientInfo client) {
        LedgerUser admin = ledgerUserRepository.findById(adminUserId)
                .filter(LedgerUser::isAdmin)
                .orElseThrow(() -> new AuthException(AuthFailure.ADMIN_REQUIRED));

        if (admin.getId().equals(targetUserId)) {
            throw new AuthException(AuthFailure.SELF_IMPERSONATION_FORBIDDEN);
        }

        LedgerUser target = (targetUserId == null ? null : ledgerUserRepository.findById(targetUserId)
                .filter(LedgerUser::isActive)
                .orElse(null));
        if (target == null) {
            throw new AuthException(AuthFailure.TARGET_USER_INACTIVE);
        }

        if (reason == null || reason.isBlank()) {
            throw new AuthException(AuthFailure.REASON_REQUIRED);
        }
        String strippedReason = reason.strip();
        if (strippedReason.length() > MAX_REASON_LENGTH) {
            throw new AuthException(AuthFailure.REASON_TOO_LONG);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        ImpersonationSession session = ImpersonationSession.start(
                admin.getId(),
                target.getId(),
                strippedReason,
                now,
                now.plus(sessionDuration)
        );
        session.setClientInfo(client.ipAddress(), client.userAgent());
        ImpersonationSession saved = sessionStore.putImpersonation(session);

        Instant issuedAt = now.toInstant();
        Instant sessionExpiry = saved.getExpiresAt().toInstant();
        Instant accessExpiry = earliest(issuedAt.plus(accessTokenTtl), sessionExpiry);
        String accessToken = tokenCodec.encode(TokenClaims.impersonation(
                TokenUse.ACCESS, target.getId(), admin.getId(), saved.getId(), issuedAt, accessExpiry));
        String refreshToken = tokenCodec.encode(TokenClaims.impersonation(
                TokenUse.REFRESH, target.getId(), admin.getId(), saved.getId(), issuedAt, sessionExpiry));

        log.info("Admin {} started impersonation {} of user {} until {}",
                admin.getId(), saved.getId(), target.getId(), saved.getExpiresAt());
        return new IssuedTokens<>(accessToken, refreshToken, secondsBetween(issuedAt, accessExpiry), saved);
    }

    /**
     * Issues a new impersonation access token from an already decoded impersonation refresh token.
     */
    public RefreshedAccess refresh(TokenClaims claims) {
        if (!claims.isImpersonation() || claims.use() != TokenUse.REFRESH) {
            throw new AuthException(AuthFailure.INVALID_TOKEN);
        }
        ImpersonationSession session = sessionStore.getImpersonation(claims.impersonationSessionId())
                .filter(found -> found.getAdminUserId().equals(claims.adminId()))
                .filter(found -> found.getTargetUserId().equals(claims.subjectId()))
                .orElseThrow(() -> new AuthException(AuthFailure.INVALID_TOKEN));

        OffsetDateTime now = OffsetDateTime.now(clock);
        ImpersonationStatus status = session.statusAt(now);
        if (status == ImpersonationStatus.REVOKED) {
            throw new AuthException(AuthFailure.SESSION_REVOKED);
        }
        if (status == ImpersonationStatus.EXPIRED) {
            throw new AuthException(AuthFailure.SESSION_EXPIRED);
        }

        Instant issuedAt = now.toInstant();
        Instant accessExpiry = earliest(issuedAt.plus(accessTokenTtl), session.getExpiresAt().toInstant());
        String accessToken = tokenCodec.encode(TokenClaims.impersonation(
                TokenUse.ACCESS,
                session.getTargetUserId(),
                session.getAdminUserId(),
                session.getId(),
                issuedAt,
                accessExpiry
        ));
        return new RefreshedAccess(accessToken, secondsBetween(issuedAt, accessExpiry), session.getTargetUserId());
    }

    /**
     * Ends an impersonation session on behalf of the administrator who started it. Ending an
     * already revoked or expired session succeeds and keeps the original end time.
     *
     * @return true when this call moved the session to revoked, false when it was already terminal
     */
    public boolean end(UUID adminUserId, UUID sessionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        EndOutcome outcome = sessionStore.updateImpersonation(sessionId, session -> {
                    if (!session.getAdminUserId().equals(adminUserId)) {
                        return EndOutcome.NOT_OWNER;
                    }
                    return session.end(now) ? EndOutcome.ENDED : EndOutcome.ALREADY_TERMINAL;
                })
                .orElseThrow(() -> new AuthException(AuthFailure.NOT_FOUND));

        switch (outcome) {
            case NOT_OWNER -> throw new AuthException(AuthFailure.NOT_AUTHORIZED);
            case ENDED -> log.info("Admin {} ended impersonation {}", adminUserId, sessionId);
            case ALREADY_TERMINAL -> log.debug("Impersonation {} was already terminal", sessionId);
        }
        return outcome == EndOutcome.ENDED;
    }

    @Transactional(readOnly = true)
    public List<ImpersonationSessionResponse> listForAdmin(UUID adminUserId) {
        LedgerUser admin = ledgerUserRepository.findById(adminUserId)
                .filter(LedgerUser::isAdmin)
                .orElseThrow(() -> new AuthException(AuthFailure.ADMIN_REQUIRED));

        List<ImpersonationSession> sessions = sessionStore.findImpersonationsByOwner(admin.getId());
        Set<UUID> userIds = new HashSet<>();
        userIds.add(admin.getId());
        sessions.forEach(session -> userIds.add(session.getTargetUserId()));
        Map<UUID, String> usernames = ledgerUserRepository.findAllByIdIn(userIds).stream()
                .collect(Collectors.toMap(LedgerUser::getId, LedgerUser::getUsername));

        OffsetDateTime now = OffsetDateTime.now(clock);
        return sessions.stream()
                .map(session -> new ImpersonationSessionResponse(
                        session.getId(),
                        session.getAdminUserId(),
                        usernames.get(session.getAdminUserId()),
                        session.getTargetUserId(),
                        usernames.get(session.getTargetUserId()),
                        session.getReason(),
                        session.getIssuedAt(),
                        session.getExpiresAt(),
                        session.getEndedAt(),
                        session.statusAt(now)
                ))
                .toList();
    }

    /**
     * Persists the expired status of active sessions whose time is up. Reads never depend on this.
     *
     * @return number of rows rewritten
     */
    public int markLapsedSessionsExpired() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int expired = 0;
        for (UUID sessionId : sessionStore.findLapsedImpersonationIds(now)) {
            boolean changed = sessionStore.updateImpersonation(sessionId, session -> session.markExpired(now))
                    .orElse(false);
            if (changed) {
                expired++;
            }
        }
        return expired;
    }

    private static Instant earliest(Instant first, Instant second) {
        return first.isBefore(second) ? first : second;
    }

    private static long secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).getSeconds();
    }
}
