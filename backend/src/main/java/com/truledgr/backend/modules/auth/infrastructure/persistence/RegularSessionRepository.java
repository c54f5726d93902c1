package com.truledgr.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.truledgr.backend.modules.auth.domain.RegularSession;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RegularSessionRepository extends JpaRepository<RegularSession, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select rs from RegularSession rs where rs.id = :id")
    Optional<RegularSession> findByIdForUpdate(@Param("id") UUID id);

    List<RegularSession> findByUserIdOrderByIssuedAtDesc(UUID userId);
}
