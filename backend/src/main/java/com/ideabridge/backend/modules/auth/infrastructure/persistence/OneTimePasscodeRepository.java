package com.ideabridge.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.ideabridge.backend.modules.auth.domain.OneTimePasscode;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OneTimePasscodeRepository extends JpaRepository<OneTimePasscode, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update OneTimePasscode otp
               set otp.used = true
             where otp.user.id = :userId
               and otp.used = false
               and otp.expiresAt > :now
            """)
    int markActiveAsUsed(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update OneTimePasscode otp set otp.used = true where otp.id = :id and otp.used = false")
    int markUsed(@Param("id") UUID id);

    Optional<OneTimePasscode> findFirstByUser_IdAndCodeAndUsedFalseOrderByCreatedAtDesc(UUID userId, String code);
}
