package com.truledgr.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.truledgr.backend.modules.auth.application.ResolvedIdentity.ImpersonationContext;
import com.truledgr.backend.modules.auth.application.TokenCodec.InvalidTokenException;
import com.truledgr.backend.modules.auth.domain.ImpersonationSession;
import com.truledgr.backend.modules.auth.domain.RegularSession;
import com.truledgr.backend.modules.auth.domain.TokenUse;
import com.truledgr.backend.modules.auth.infrastructure.persistence.SessionStore;
import com.truledgr.backend.modules.user.domain.LedgerUser;
import com.truledgr.backend.modules.user.infrastructure.persistence.LedgerUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a bearer access token into the identity acting on the request.
 *
 * <p>A token is only a capability; the session record behind it is checked on every call, so a
 * revoked or lapsed session stops resolving before the token itself expires. All rejections
 * surface as {@link AuthFailure#UNAUTHORIZED} and are not told apart to the caller.
 */
@Service
@Transactional(readOnly = true)
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final TokenCodec tokenCodec;
    private final SessionStore sessionStore;
    private final LedgerUserRepository ledgerUserRepository;
    private final Clock clock;

    public IdentityResolver(
            TokenCodec tokenCodec,
            SessionStore sessionStore,
            LedgerUserRepository ledgerUserRepository,
            Clock clock
    ) {
        this.tokenCodec = tokenCodec;
        this.sessionStore = sessionStore;
        this.ledgerUserRepository = ledgerUserRepository;
        this.clock = clock;
    }

    public ResolvedIdentity resolve(String bearerToken) {
        TokenClaims claims;
        try {
            claims = tokenCodec.decode(bearerToken);
        } catch (InvalidTokenException ex) {
            throw reject("token rejected by codec: " + ex.getMessage());
        }
        if (claims.use() != TokenUse.ACCESS) {
            throw reject("refresh token presented as bearer credential");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        return claims.isImpersonation()
                ? resolveImpersonation(claims, now)
                : resolveRegular(claims, now);
    }

    private ResolvedIdentity resolveRegular(TokenClaims claims, OffsetDateTime now) {
        RegularSession session = sessionStore.getRegular(claims.sessionId())
                .orElseThrow(() -> reject("regular session not found"));
        if (!session.getUserId().equals(claims.subjectId())) {
            throw reject("regular session owner mismatch");
        }
        if (session.isRevoked()) {
            throw reject("regular session revoked");
        }
        if (session.isExpiredAt(now)) {
            throw reject("regular session expired");
        }

        LedgerUser user = activeUser(claims).orElseThrow(() -> reject("subject user inactive or missing"));
        return new ResolvedIdentity(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.isAdmin(),
                session.getId(),
                null
        );
    }

    private ResolvedIdentity resolveImpersonation(TokenClaims claims, OffsetDateTime now) {
        ImpersonationSession session = sessionStore.getImpersonation(claims.impersonationSessionId())
                .orElseThrow(() -> reject("impersonation session not found"));
        if (!session.getTargetUserId().equals(claims.subjectId())
                || !session.getAdminUserId().equals(claims.adminId())) {
            throw reject("impersonation claims do not match session");
        }
        // stored status alone is not enough: an active row past expires_at is already expired
        if (!session.isActiveAt(now)) {
            throw reject("impersonation session " + session.statusAt(now).value());
        }

        LedgerUser target = activeUser(claims).orElseThrow(() -> reject("impersonated user inactive or missing"));
        LedgerUser admin = ledgerUserRepository.findById(session.getAdminUserId())
                .filter(LedgerUser::isActive)
                .filter(LedgerUser::isAdmin)
                .orElseThrow(() -> reject("impersonating administrator no longer eligible"));

        return new ResolvedIdentity(
                target.getId(),
                target.getUsername(),
                target.getEmail(),
                target.isAdmin(),
                null,
                new ImpersonationContext(admin.getId(), admin.getUsername(), session.getId(), session.getReason())
        );
    }

    private Optional<LedgerUser> activeUser(TokenClaims claims) {
        return ledgerUserRepository.findById(claims.subjectId()).filter(LedgerUser::isActive);
    }

    private static AuthException reject(String why) {
        log.debug("Identity resolution rejected: {}", why);
        return new AuthException(AuthFailure.UNAUTHORIZED);
    }
}
