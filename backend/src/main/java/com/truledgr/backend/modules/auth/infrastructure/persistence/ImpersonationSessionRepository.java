package com.truledgr.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.truledgr.backend.modules.auth.domain.ImpersonationSession;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ImpersonationSessionRepository extends JpaRepository<ImpersonationSession, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ImpersonationSession s where s.id = :id")
    Optional<ImpersonationSession> findByIdForUpdate(@Param("id") UUID id);

    List<ImpersonationSession> findByAdminUserIdOrderByIssuedAtDesc(UUID adminUserId);

    @Query("""
            select s.id
              from ImpersonationSession s
             where s.status = com.truledgr.backend.modules.auth.domain.ImpersonationStatus.ACTIVE
               and s.expiresAt <= :now
            """)
    List<UUID> findLapsedActiveIds(@Param("now") OffsetDateTime now);
}
