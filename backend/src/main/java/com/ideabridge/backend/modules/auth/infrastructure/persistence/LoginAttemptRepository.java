package com.ideabridge.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.ideabridge.backend.modules.auth.domain.LoginAttempt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoginAttemptRepository extends JpaRepository<LoginAttempt, UUID> {

    @Query("""
            select count(la)
              from LoginAttempt la
             where la.identifier = :identifier
               and la.success = false
               and la.attemptAt >= :windowStart
            """)
    long countFailuresSince(@Param("identifier") String identifier, @Param("windowStart") OffsetDateTime windowStart);

    Optional<LoginAttempt> findFirstByIdentifierAndSuccessFalseAndAttemptAtGreaterThanEqualOrderByAttemptAtAsc(
            String identifier,
            OffsetDateTime windowStart
    );
}
