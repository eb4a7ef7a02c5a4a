package com.latchkey.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.AppUser;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    /**
     * Emails are stored normalized, so callers must pass a normalized value.
     */
    Optional<AppUser> findByEmail(String email);

    boolean existsByEmail(String email);

    @Query("""
            select case when count(u) > 0 then true else false end
              from AppUser u
             where u.email = :email
               and u.id <> :excludedId
            """)
    boolean existsByEmailOnOtherUser(@Param("email") String email, @Param("excludedId") UUID excludedId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from AppUser u where u.id = :id")
    Optional<AppUser> findByIdForUpdate(@Param("id") UUID id);
}
