package com.ideabridge.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One login or OTP attempt, keyed by the identifier the caller supplied (username or mobile number).
 */
@Entity
@Table(name = "login_attempt")
public class LoginAttempt {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "identifier", nullable = false, columnDefinition = "text")
    private String identifier;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "attempt_at", nullable = false)
    private OffsetDateTime attemptAt;

    @Column(name = "user_id", columnDefinition = "uuid")
    private UUID userId;

    public UUID getId() {
        return id;
    }

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public OffsetDateTime getAttemptAt() {
        return attemptAt;
    }

    public void setAttemptAt(OffsetDateTime attemptAt) {
        this.attemptAt = attemptAt;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }
}
