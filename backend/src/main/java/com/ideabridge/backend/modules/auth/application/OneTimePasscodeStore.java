package com.ideabridge.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.ideabridge.backend.modules.auth.domain.AppUser;
import com.ideabridge.backend.modules.auth.domain.OneTimePasscode;
import com.ideabridge.backend.modules.auth.domain.OtpValidationResult;
import com.ideabridge.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.ideabridge.backend.modules.auth.infrastructure.persistence.OneTimePasscodeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and checks six-digit one-time passcodes. A user has at most one unused, unexpired code at any
 * time: issuing a new one retires the previous ones in the same transaction.
 */
@Service
public class OneTimePasscodeStore {

    private static final Logger log = LoggerFactory.getLogger(OneTimePasscodeStore.class);

    private static final int CODE_BOUND = 1_000_000;

    private final OneTimePasscodeRepository oneTimePasscodeRepository;
    private final AppUserRepository appUserRepository;
    private final Clock clock;
    private final int defaultTtlMinutes;
    private final SecureRandom secureRandom = new SecureRandom();

    public OneTimePasscodeStore(
            OneTimePasscodeRepository oneTimePasscodeRepository,
            AppUserRepository appUserRepository,
            Clock clock,
            @Value("${auth.otp.expiry-minutes:5}") int defaultTtlMinutes
    ) {
        this.oneTimePasscodeRepository = oneTimePasscodeRepository;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
        this.defaultTtlMinutes = defaultTtlMinutes;
    }

    public String generateCode() {
        return String.format("%06d", secureRandom.nextInt(CODE_BOUND));
    }

    @Transactional
    public String issue(UUID userId) {
        return issue(userId, defaultTtlMinutes);
    }

    /**
     * Retires every active code of the user and stores a fresh one.
     *
     * @return the plaintext code; delivering it is the caller's job
     */
    @Transactional
    public String issue(UUID userId, int ttlMinutes) {
        Objects.requireNonNull(userId, "userId is required");
        if (ttlMinutes <= 0) {
            throw new IllegalArgumentException("ttlMinutes must be positive");
        }
        AppUser user = appUserRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("Cannot issue an OTP for unknown user " + userId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        int superseded = oneTimePasscodeRepository.markActiveAsUsed(userId, now);
        if (superseded > 0) {
            log.debug("Superseded {} active OTP(s) for user {}", superseded, userId);
        }

        String code = generateCode();
        OneTimePasscode otp = new OneTimePasscode();
        otp.setUser(user);
        otp.setCode(code);
        otp.setExpiresAt(now.plusMinutes(ttlMinutes));
        otp.setUsed(false);
        otp.setCreatedAt(now);
        oneTimePasscodeRepository.save(otp);
        return code;
    }

    /**
     * Looks the code up without consuming it. Call {@link #invalidate(UUID)} once the caller has acted on a
     * valid result.
     */
    @Transactional(readOnly = true)
    public OtpValidationResult validate(UUID userId, String code) {
        if (userId == null || code == null) {
            return OtpValidationResult.invalid();
        }
        return oneTimePasscodeRepository.findFirstByUser_IdAndCodeAndUsedFalseOrderByCreatedAtDesc(userId, code)
                .map(otp -> otp.isExpiredAt(OffsetDateTime.now(clock))
                        ? OtpValidationResult.expired()
                        : OtpValidationResult.valid(otp.getId()))
                .orElseGet(OtpValidationResult::invalid);
    }

    /**
     * Marks the code used. Safe to repeat.
     *
     * @return {@code true} only for the call that actually consumed the code
     */
    @Transactional
    public boolean invalidate(UUID otpId) {
        return oneTimePasscodeRepository.markUsed(otpId) > 0;
    }
}
