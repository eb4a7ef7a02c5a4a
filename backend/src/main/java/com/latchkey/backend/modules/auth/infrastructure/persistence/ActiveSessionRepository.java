package com.latchkey.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.ActiveSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ActiveSessionRepository extends JpaRepository<ActiveSession, UUID> {

    @Query("""
            select s
              from ActiveSession s
              join fetch s.user
             where s.id = :id
            """)
    Optional<ActiveSession> findWithUserById(@Param("id") UUID id);

    @Query("""
            select s
              from ActiveSession s
              join fetch s.user
             where s.rememberToken = :rememberToken
            """)
    Optional<ActiveSession> findWithUserByRememberToken(@Param("rememberToken") String rememberToken);

    @Query("""
            select s
              from ActiveSession s
             where s.user.id = :userId
             order by s.createdAt desc, s.id
            """)
    List<ActiveSession> findAllByUserIdNewestFirst(@Param("userId") UUID userId);

    @Query("""
            select s
              from ActiveSession s
             where s.id = :id
               and s.user.id = :userId
            """)
    Optional<ActiveSession> findOwnedBy(@Param("id") UUID id, @Param("userId") UUID userId);

    @Query("select count(s) from ActiveSession s where s.user.id = :userId")
    long countByUserId(@Param("userId") UUID userId);

    @Modifying
    @Query("delete from ActiveSession s where s.id = :id")
    int deleteActiveSession(@Param("id") UUID id);

    @Modifying
    @Query("delete from ActiveSession s where s.user.id = :userId")
    int deleteAllOwnedBy(@Param("userId") UUID userId);
}
