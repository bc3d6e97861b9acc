package com.ideabridge.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.ideabridge.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user
             where us.token = :token
            """)
    Optional<UserSession> findByTokenWithUser(@Param("token") String token);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSession us where us.id = :id")
    int deleteSessionById(@Param("id") UUID id);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSession us where us.token = :token")
    int deleteByToken(@Param("token") String token);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSession us where us.user.id = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true)
    @Query("delete from UserSession us where us.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
