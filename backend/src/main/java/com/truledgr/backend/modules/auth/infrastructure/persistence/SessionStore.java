package com.truledgr.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import com.truledgr.backend.modules.auth.domain.ImpersonationSession;
import com.truledgr.backend.modules.auth.domain.RegularSession;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Storage indirection shared by the session lifecycle and impersonation services.
 *
 * <p>Regular and impersonation sessions are kept as separate record kinds with separate
 * operations. Owner lookups are keyed by user id for regular sessions and by administrator id
 * for impersonation sessions. {@code update*} methods lock the row for the duration of the
 * surrounding transaction, so concurrent mutations of one record are applied one after the
 * other against fresh state. Mutators report outcomes through their return value and must not
 * throw. No business rules live here.
 */
@Component
@Transactional
public class SessionStore {

    private final RegularSessionRepository regularSessionRepository;
    private final ImpersonationSessionRepository impersonationSessionRepository;
    private final EntityManager entityManager;

    public SessionStore(
            RegularSessionRepository regularSessionRepository,
            ImpersonationSessionRepository impersonationSessionRepository,
            EntityManager entityManager
    ) {
        this.regularSessionRepository = regularSessionRepository;
        this.impersonationSessionRepository = impersonationSessionRepository;
        this.entityManager = entityManager;
    }

    public RegularSession putRegular(RegularSession session) {
        return regularSessionRepository.save(session);
    }

    @Transactional(readOnly = true)
    public Optional<RegularSession> getRegular(UUID id) {
        return regularSessionRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<RegularSession> findRegularByOwner(UUID userId) {
        return regularSessionRepository.findByUserIdOrderByIssuedAtDesc(userId);
    }

    /**
     * Locks the row, applies the mutator and returns its result, or empty when the id is unknown.
     */
    public <R> Optional<R> updateRegular(UUID id, Function<RegularSession, R> mutator) {
        return regularSessionRepository.findByIdForUpdate(id)
                .map(session -> {
                    // the row may already sit in the persistence context with pre-lock state
                    entityManager.refresh(session);
                    R result = mutator.apply(session);
                    regularSessionRepository.save(session);
                    return result;
                });
    }

    public ImpersonationSession putImpersonation(ImpersonationSession session) {
        return impersonationSessionRepository.save(session);
    }

    @Transactional(readOnly = true)
    public Optional<ImpersonationSession> getImpersonation(UUID id) {
        return impersonationSessionRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<ImpersonationSession> findImpersonationsByOwner(UUID adminUserId) {
        return impersonationSessionRepository.findByAdminUserIdOrderByIssuedAtDesc(adminUserId);
    }

    public <R> Optional<R> updateImpersonation(UUID id, Function<ImpersonationSession, R> mutator) {
        return impersonationSessionRepository.findByIdForUpdate(id)
                .map(session -> {
                    entityManager.refresh(session);
                    R result = mutator.apply(session);
                    impersonationSessionRepository.save(session);
                    return result;
                });
    }

    @Transactional(readOnly = true)
    public List<UUID> findLapsedImpersonationIds(OffsetDateTime now) {
        return impersonationSessionRepository.findLapsedActiveIds(now);
    }
}
