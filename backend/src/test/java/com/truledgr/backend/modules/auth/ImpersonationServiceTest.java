package com.truledgr.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import com.truledgr.backend.modules.auth.application.AuthException;
import com.truledgr.backend.modules.auth.application.AuthFailure;
import com.truledgr.backend.modules.auth.application.ClientInfo;
import com.truledgr.backend.modules.auth.application.ImpersonationService;
import com.truledgr.backend.modules.auth.application.IssuedTokens;
import com.truledgr.backend.modules.auth.application.RefreshedAccess;
import com.truledgr.backend.modules.auth.application.TokenClaims;
import com.truledgr.backend.modules.auth.application.TokenCodec;
import com.truledgr.backend.modules.auth.domain.ImpersonationSession;
import com.truledgr.backend.modules.auth.domain.ImpersonationStatus;
import com.truledgr.backend.modules.auth.domain.TokenUse;
import com.truledgr.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.truledgr.backend.modules.auth.infrastructure.persistence.SessionStore;
import com.truledgr.backend.modules.auth.presentation.dto.ImpersonationSessionResponse;
import com.truledgr.backend.modules.user.domain.LedgerUser;
import com.truledgr.backend.modules.user.infrastructure.persistence.LedgerUserRepository;
import com.truledgr.backend.support.AbstractIntegrationTest;
import com.truledgr.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ImpersonationServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");
    private static final long ACCESS_TTL_MILLIS = 900_000L;
    private static final int REASON_LIMIT = 500;

    @Mock
    private LedgerUserRepository ledgerUserRepository;

    @Mock
    private SessionStore sessionStore;

    private TokenCodec tokenCodec;
    private ImpersonationService impersonationService;

    private LedgerUser admin;
    private LedgerUser otherAdmin;
    private LedgerUser target;
    private LedgerUser plainUser;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        tokenCodec = new TokenCodec(new JwtTokenProvider(AbstractIntegrationTest.TEST_JWT_SECRET), clock);
        impersonationService = new ImpersonationService(
                ledgerUserRepository,
                sessionStore,
                tokenCodec,
                clock,
                ACCESS_TTL_MILLIS,
                Duration.ofHours(2)
        );

        admin = TestEntities.user(UUID.randomUUID(), "admin", true, true);
        otherAdmin = TestEntities.user(UUID.randomUUID(), "other-admin", true, true);
        target = TestEntities.user(UUID.randomUUID(), "target", false, true);
        plainUser = TestEntities.user(UUID.randomUUID(), "plain", false, true);
        for (LedgerUser user : List.of(admin, otherAdmin, target, plainUser)) {
            lenient().when(ledgerUserRepository.findById(user.getId())).thenReturn(Optional.of(user));
        }
    }

    @Test
    void startIssuesTokensBoundToTheNewSession() {
        when(sessionStore.putImpersonation(any())).thenAnswer(invocation ->
                TestEntities.withId(invocation.getArgument(0, ImpersonationSession.class), UUID.randomUUID()));

        IssuedTokens<ImpersonationSession> issued = impersonationService.start(
                admin.getId(), target.getId(), "  support ticket 42 ", ClientInfo.of("10.0.0.1", "curl/8"));

        ImpersonationSession session = issued.session();
        assertThat(session.getReason()).isEqualTo("support ticket 42");
        assertThat(session.getStatus()).isEqualTo(ImpersonationStatus.ACTIVE);
        assertThat(session.getExpiresAt()).isEqualTo(NOW.plusHours(2));
        assertThat(session.getIpAddress()).isEqualTo("10.0.0.1");
        assertThat(session.getUserAgent()).isEqualTo("curl/8");
        assertThat(issued.expiresIn()).isEqualTo(900L);

        TokenClaims access = tokenCodec.decode(issued.accessToken());
        assertThat(access.use()).isEqualTo(TokenUse.ACCESS);
        assertThat(access.subjectId()).isEqualTo(target.getId());
        assertThat(access.adminId()).isEqualTo(admin.getId());
        assertThat(access.impersonationSessionId()).isEqualTo(session.getId());

        TokenClaims refresh = tokenCodec.decode(issued.refreshToken());
        assertThat(refresh.use()).isEqualTo(TokenUse.REFRESH);
        assertThat(refresh.expiresAt()).isEqualTo(session.getExpiresAt().toInstant());
    }

    @Test
    void startRequiresAdminBeforeAnythingElse() {
        assertThatThrownBy(() -> impersonationService.start(plainUser.getId(), plainUser.getId(), "", ClientInfo.UNKNOWN))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.ADMIN_REQUIRED));
        verify(sessionStore, never()).putImpersonation(any());
    }

    @Test
    void startRequiresAdminEvenWhenTargetAndReasonAreInvalid() {
        String overLong = "x".repeat(REASON_LIMIT + 100);
        for (String reason : new String[] {"support", overLong}) {
            assertThatThrownBy(() -> impersonationService.start(plainUser.getId(), null, reason, ClientInfo.UNKNOWN))
                    .isInstanceOfSatisfying(AuthException.class,
                            ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.ADMIN_REQUIRED));
        }
        verify(sessionStore, never()).putImpersonation(any());
    }

    @Test
    void startRejectsOverLongReasonAfterTargetChecks() {
        String overLong = "x".repeat(REASON_LIMIT + 1);
        UUID unknown = UUID.randomUUID();
        when(ledgerUserRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> impersonationService.start(admin.getId(), target.getId(), overLong, ClientInfo.UNKNOWN))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.REASON_TOO_LONG));
        assertThatThrownBy(() -> impersonationService.start(admin.getId(), unknown, overLong, ClientInfo.UNKNOWN))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.TARGET_USER_INACTIVE));
        verify(sessionStore, never()).putImpersonation(any());
    }

    @Test
    void startAcceptsReasonAtTheLengthLimit() {
        when(sessionStore.putImpersonation(any())).thenAnswer(invocation ->
                TestEntities.withId(invocation.getArgument(0, ImpersonationSession.class), UUID.randomUUID()));
        String atLimit = " " + "x".repeat(REASON_LIMIT) + " ";

        IssuedTokens<ImpersonationSession> issued =
                impersonationService.start(admin.getId(), target.getId(), atLimit, ClientInfo.UNKNOWN);

        assertThat(issued.session().getReason()).hasSize(REASON_LIMIT);
    }

    @Test
    void startRefusesSelfImpersonationWhateverTheReason() {
        for (String reason : new String[] {"support", "", null}) {
            assertThatThrownBy(() -> impersonationService.start(admin.getId(), admin.getId(), reason, ClientInfo.UNKNOWN))
                    .isInstanceOfSatisfying(AuthException.class,
                            ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.SELF_IMPERSONATION_FORBIDDEN));
        }
    }

    @Test
    void startTreatsMissingAndInactiveTargetsAlike() {
        LedgerUser inactive = TestEntities.user(UUID.randomUUID(), "gone", false, false);
        when(ledgerUserRepository.findById(inactive.getId())).thenReturn(Optional.of(inactive));
        UUID unknown = UUID.randomUUID();
        when(ledgerUserRepository.findById(unknown)).thenReturn(Optional.empty());

        for (UUID targetId : List.of(inactive.getId(), unknown)) {
            assertThatThrownBy(() -> impersonationService.start(admin.getId(), targetId, "support", ClientInfo.UNKNOWN))
                    .isInstanceOfSatisfying(AuthException.class,
                            ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.TARGET_USER_INACTIVE));
        }
    }

    @Test
    void startRequiresNonBlankReason() {
        assertThatThrownBy(() -> impersonationService.start(admin.getId(), target.getId(), "   ", ClientInfo.UNKNOWN))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.REASON_REQUIRED));
        verify(sessionStore, never()).putImpersonation(any());
    }

    @Test
    void endRevokesActiveSession() {
        ImpersonationSession session = storedSession(admin, NOW.minusMinutes(30));

        boolean ended = impersonationService.end(admin.getId(), session.getId());

        assertThat(ended).isTrue();
        assertThat(session.getStatus()).isEqualTo(ImpersonationStatus.REVOKED);
        assertThat(session.getEndedAt()).isEqualTo(NOW);
    }

    @Test
    void endIsIdempotentForTerminalSessions() {
        ImpersonationSession session = storedSession(admin, NOW.minusMinutes(30));
        session.end(NOW.minusMinutes(5));

        boolean ended = impersonationService.end(admin.getId(), session.getId());

        assertThat(ended).isFalse();
        assertThat(session.getEndedAt()).isEqualTo(NOW.minusMinutes(5));
    }

    @Test
    void endByAnotherAdminIsNotAuthorized() {
        ImpersonationSession session = storedSession(admin, NOW.minusMinutes(30));

        assertThatThrownBy(() -> impersonationService.end(otherAdmin.getId(), session.getId()))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.NOT_AUTHORIZED));
        assertThat(session.getStatus()).isEqualTo(ImpersonationStatus.ACTIVE);
    }

    @Test
    void endOfUnknownSessionIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(sessionStore.updateImpersonation(eq(missing), any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> impersonationService.end(admin.getId(), missing))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.NOT_FOUND));
    }

    @Test
    void listShowsEffectiveStatusAndUsernames() {
        ImpersonationSession lapsed = TestEntities.withId(ImpersonationSession.start(
                admin.getId(), target.getId(), "old", NOW.minusHours(3), NOW.minusHours(1)), UUID.randomUUID());
        ImpersonationSession current = TestEntities.withId(ImpersonationSession.start(
                admin.getId(), target.getId(), "new", NOW.minusMinutes(10), NOW.plusMinutes(110)), UUID.randomUUID());
        when(sessionStore.findImpersonationsByOwner(admin.getId())).thenReturn(List.of(current, lapsed));
        when(ledgerUserRepository.findAllByIdIn(any())).thenReturn(List.of(admin, target));

        List<ImpersonationSessionResponse> listed = impersonationService.listForAdmin(admin.getId());

        assertThat(listed).extracting(ImpersonationSessionResponse::status)
                .containsExactly(ImpersonationStatus.ACTIVE, ImpersonationStatus.EXPIRED);
        assertThat(listed).allSatisfy(row -> {
            assertThat(row.adminUsername()).isEqualTo("admin");
            assertThat(row.targetUsername()).isEqualTo("target");
        });
    }

    @Test
    void listRequiresAdmin() {
        assertThatThrownBy(() -> impersonationService.listForAdmin(plainUser.getId()))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.ADMIN_REQUIRED));
    }

    @Test
    void refreshNeverOutlivesTheSession() {
        ImpersonationSession session = TestEntities.withId(ImpersonationSession.start(
                admin.getId(), target.getId(), "support", NOW.minusMinutes(115), NOW.plusMinutes(5)), UUID.randomUUID());
        when(sessionStore.getImpersonation(session.getId())).thenReturn(Optional.of(session));

        RefreshedAccess refreshed = impersonationService.refresh(refreshClaims(session));

        assertThat(refreshed.expiresIn()).isEqualTo(300L);
        assertThat(refreshed.subjectId()).isEqualTo(target.getId());
        TokenClaims access = tokenCodec.decode(refreshed.accessToken());
        assertThat(access.expiresAt()).isEqualTo(session.getExpiresAt().toInstant());
    }

    @Test
    void refreshOfEndedSessionIsRevoked() {
        ImpersonationSession session = TestEntities.withId(ImpersonationSession.start(
                admin.getId(), target.getId(), "support", NOW.minusMinutes(10), NOW.plusMinutes(110)), UUID.randomUUID());
        session.end(NOW.minusMinutes(1));
        when(sessionStore.getImpersonation(session.getId())).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> impersonationService.refresh(refreshClaims(session)))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.SESSION_REVOKED));
    }

    @Test
    void refreshOfLapsedSessionIsExpired() {
        ImpersonationSession session = TestEntities.withId(ImpersonationSession.start(
                admin.getId(), target.getId(), "support", NOW.minusHours(2), NOW), UUID.randomUUID());
        when(sessionStore.getImpersonation(session.getId())).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> impersonationService.refresh(refreshClaims(session)))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthFailure.SESSION_EXPIRED));
    }

    @Test
    void sweepRewritesOnlyLapsedRows() {
        ImpersonationSession lapsed = storedSession(admin, NOW.minusHours(3));
        when(sessionStore.findLapsedImpersonationIds(NOW)).thenReturn(List.of(lapsed.getId()));

        int expired = impersonationService.markLapsedSessionsExpired();

        assertThat(expired).isEqualTo(1);
        assertThat(lapsed.getStatus()).isEqualTo(ImpersonationStatus.EXPIRED);
        assertThat(lapsed.getEndedAt()).isNull();
    }

    private ImpersonationSession storedSession(LedgerUser owner, OffsetDateTime issuedAt) {
        ImpersonationSession session = TestEntities.withId(ImpersonationSession.start(
                owner.getId(), target.getId(), "support", issuedAt, issuedAt.plusHours(2)), UUID.randomUUID());
        when(sessionStore.updateImpersonation(eq(session.getId()), any())).thenAnswer(invocation -> {
            Function<ImpersonationSession, ?> mutator = invocation.getArgument(1);
            return Optional.ofNullable(mutator.apply(session));
        });
        return session;
    }

    private static TokenClaims refreshClaims(ImpersonationSession session) {
        Instant issuedAt = NOW.toInstant();
        return TokenClaims.impersonation(
                TokenUse.REFRESH,
                session.getTargetUserId(),
                session.getAdminUserId(),
                session.getId(),
                issuedAt,
                session.getExpiresAt().toInstant()
        );
    }
}
