package com.ideabridge.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.ideabridge.backend.modules.auth.domain.AppUser;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByUsername(String username);

    Optional<AppUser> findByMobileNumber(String mobileNumber);

    /**
     * Row lock on the user, held until the surrounding transaction ends. Serialises OTP issuance per user.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from AppUser u where u.id = :id")
    Optional<AppUser> findByIdForUpdate(@Param("id") UUID id);
}
