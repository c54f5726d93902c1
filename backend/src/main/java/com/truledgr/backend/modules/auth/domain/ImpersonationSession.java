package com.truledgr.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.truledgr.backend.global.jpa.AuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Audited, time-boxed record of an administrator acting as another user.
 *
 * <p>Status moves only {@code ACTIVE -> REVOKED} (explicit end) or {@code ACTIVE -> EXPIRED}.
 * Expiry is observed from the clock at read time: a row stored as {@code ACTIVE} whose
 * {@code expiresAt} has passed is reported as {@code EXPIRED} without being rewritten.
 */
@Entity
@Table(name = "impersonation_session")
public class ImpersonationSession extends AuditedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "admin_user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID adminUserId;

    @Column(name = "target_user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID targetUserId;

    @Column(name = "reason", nullable = false, updatable = false, length = 500)
    private String reason;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "ended_at")
    private OffsetDateTime endedAt;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(name = "status", nullable = false, length = 16)
    private ImpersonationStatus status;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 255)
    private String userAgent;

    protected ImpersonationSession() {
    }

    public static ImpersonationSession start(
            UUID adminUserId,
            UUID targetUserId,
            String reason,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
        Objects.requireNonNull(adminUserId, "adminUserId is required");
        Objects.requireNonNull(targetUserId, "targetUserId is required");
        if (adminUserId.equals(targetUserId)) {
            throw new IllegalArgumentException("administrator and target must differ");
        }
        ImpersonationSession session = new ImpersonationSession();
        session.adminUserId = adminUserId;
        session.targetUserId = targetUserId;
        session.reason = reason;
        session.issuedAt = issuedAt;
        session.expiresAt = expiresAt;
        session.status = ImpersonationStatus.ACTIVE;
        return session;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getAdminUserId() {
        return adminUserId;
    }

    public UUID getTargetUserId() {
        return targetUserId;
    }

    public String getReason() {
        return reason;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getEndedAt() {
        return endedAt;
    }

    /**
     * Stored status, which may lag behind the clock. Use {@link #statusAt(OffsetDateTime)} for decisions.
     */
    public ImpersonationStatus getStatus() {
        return status;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setClientInfo(String ipAddress, String userAgent) {
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
    }

    public ImpersonationStatus statusAt(OffsetDateTime now) {
        if (status == ImpersonationStatus.ACTIVE && !now.isBefore(expiresAt)) {
            return ImpersonationStatus.EXPIRED;
        }
        return status;
    }

    public boolean isActiveAt(OffsetDateTime now) {
        return statusAt(now) == ImpersonationStatus.ACTIVE;
    }

    /**
     * Ends an active session. Returns {@code false} and leaves the row untouched when the
     * session is already revoked or expired.
     */
    public boolean end(OffsetDateTime now) {
        if (statusAt(now).isTerminal()) {
            return false;
        }
        this.status = ImpersonationStatus.REVOKED;
        this.endedAt = now;
        return true;
    }

    /**
     * Persists an expiry that has already happened. Only the expiry sweep calls this.
     */
    public boolean markExpired(OffsetDateTime now) {
        if (status != ImpersonationStatus.ACTIVE || now.isBefore(expiresAt)) {
            return false;
        }
        this.status = ImpersonationStatus.EXPIRED;
        return true;
    }
}
