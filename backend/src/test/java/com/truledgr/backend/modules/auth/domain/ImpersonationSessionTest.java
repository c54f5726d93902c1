package com.truledgr.backend.modules.auth.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class ImpersonationSessionTest {

    private static final OffsetDateTime START = OffsetDateTime.parse("2025-03-01T09:00:00Z");
    private static final UUID ADMIN_ID = UUID.randomUUID();
    private static final UUID TARGET_ID = UUID.randomUUID();

    @Test
    void activeRowReadsAsExpiredOnceTimeIsUp() {
        ImpersonationSession session = newSession();

        assertThat(session.statusAt(START.plusMinutes(119))).isEqualTo(ImpersonationStatus.ACTIVE);
        assertThat(session.statusAt(START.plusHours(2))).isEqualTo(ImpersonationStatus.EXPIRED);
        assertThat(session.getStatus()).isEqualTo(ImpersonationStatus.ACTIVE);
    }

    @Test
    void endKeepsFirstEndTime() {
        ImpersonationSession session = newSession();

        assertThat(session.end(START.plusMinutes(10))).isTrue();
        assertThat(session.end(START.plusMinutes(20))).isFalse();

        assertThat(session.getStatus()).isEqualTo(ImpersonationStatus.REVOKED);
        assertThat(session.getEndedAt()).isEqualTo(START.plusMinutes(10));
    }

    @Test
    void endAfterExpiryChangesNothing() {
        ImpersonationSession session = newSession();

        assertThat(session.end(START.plusHours(3))).isFalse();

        assertThat(session.getStatus()).isEqualTo(ImpersonationStatus.ACTIVE);
        assertThat(session.getEndedAt()).isNull();
        assertThat(session.statusAt(START.plusHours(3))).isEqualTo(ImpersonationStatus.EXPIRED);
    }

    @Test
    void markExpiredOnlyTouchesLapsedActiveRows() {
        ImpersonationSession lapsed = newSession();
        ImpersonationSession revoked = newSession();
        revoked.end(START.plusMinutes(5));

        assertThat(lapsed.markExpired(START.plusMinutes(30))).isFalse();
        assertThat(lapsed.markExpired(START.plusHours(2))).isTrue();
        assertThat(lapsed.getStatus()).isEqualTo(ImpersonationStatus.EXPIRED);
        assertThat(lapsed.getEndedAt()).isNull();

        assertThat(revoked.markExpired(START.plusHours(2))).isFalse();
        assertThat(revoked.getStatus()).isEqualTo(ImpersonationStatus.REVOKED);
    }

    @Test
    void adminCannotImpersonateThemselves() {
        assertThatThrownBy(() -> ImpersonationSession.start(ADMIN_ID, ADMIN_ID, "support", START, START.plusHours(2)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ImpersonationSession newSession() {
        return ImpersonationSession.start(ADMIN_ID, TARGET_ID, "support", START, START.plusHours(2));
    }
}
