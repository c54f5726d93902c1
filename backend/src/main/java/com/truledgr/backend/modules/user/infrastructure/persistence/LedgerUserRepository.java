package com.truledgr.backend.modules.user.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.truledgr.backend.modules.user.domain.LedgerUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LedgerUserRepository extends JpaRepository<LedgerUser, UUID> {

    @Query("select lu from LedgerUser lu where lower(lu.username) = lower(:username)")
    Optional<LedgerUser> findByUsernameIgnoreCase(@Param("username") String username);

    @Query("select lu from LedgerUser lu where lu.id in :ids")
    List<LedgerUser> findAllByIdIn(@Param("ids") Collection<UUID> ids);
}
