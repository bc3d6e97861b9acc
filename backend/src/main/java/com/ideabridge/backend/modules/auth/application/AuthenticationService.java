package com.ideabridge.backend.modules.auth.application;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import com.ideabridge.backend.global.error.AuthErrorCode;
import com.ideabridge.backend.global.error.AuthException;
import com.ideabridge.backend.modules.auth.domain.AppUser;
import com.ideabridge.backend.modules.auth.domain.AuthSession;
import com.ideabridge.backend.modules.auth.domain.OtpValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for registration and login.
 * <p>
 * Unknown identities, password logins against mobile-only accounts and wrong passwords all fail with
 * {@link AuthException#authenticationFailed()} so callers cannot probe which accounts exist.
 * Rate limiting is applied around this service by {@link AuthenticationGateway}.
 */
@Service
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    static final String OTP_SEND_FAILED_MESSAGE = "Failed to send OTP";

    private final IdentityRegistry identityRegistry;
    private final PasswordHasher passwordHasher;
    private final OneTimePasscodeStore oneTimePasscodeStore;
    private final SessionStore sessionStore;
    private final SmsSender smsSender;

    public AuthenticationService(
            IdentityRegistry identityRegistry,
            PasswordHasher passwordHasher,
            OneTimePasscodeStore oneTimePasscodeStore,
            SessionStore sessionStore,
            SmsSender smsSender
    ) {
        this.identityRegistry = identityRegistry;
        this.passwordHasher = passwordHasher;
        this.oneTimePasscodeStore = oneTimePasscodeStore;
        this.sessionStore = sessionStore;
        this.smsSender = smsSender;
    }

    public AppUser registerWithCredentials(String username, String password) {
        return identityRegistry.registerWithCredentials(username, password);
    }

    public AppUser registerWithMobile(String mobileNumber) {
        return identityRegistry.registerWithMobile(mobileNumber);
    }

    /**
     * Issues a fresh passcode and hands it to the SMS transport. Failing to store or deliver the code
     * is reported as {@code OTP_SEND_FAILED}. A failed delivery leaves the issued code in place; the next
     * request supersedes it.
     */
    public void requestOtp(String mobileNumber) {
        AppUser user = identityRegistry.findByMobileNumber(mobileNumber)
                .orElseThrow(AuthException::authenticationFailed);

        String code;
        try {
            code = oneTimePasscodeStore.issue(user.getId());
        } catch (RuntimeException e) {
            log.error("Failed to issue OTP for {}", maskMobileNumber(mobileNumber), e);
            throw new AuthException(OTP_SEND_FAILED_MESSAGE, AuthErrorCode.OTP_SEND_FAILED);
        }
        try {
            smsSender.sendOtp(mobileNumber, code);
        } catch (RuntimeException e) {
            log.error("Failed to deliver OTP to {}", maskMobileNumber(mobileNumber), e);
            throw new AuthException(OTP_SEND_FAILED_MESSAGE, AuthErrorCode.OTP_SEND_FAILED);
        }
    }

    public AuthSession verifyOtp(String mobileNumber, String code) {
        AppUser user = identityRegistry.findByMobileNumber(mobileNumber)
                .orElseThrow(AuthException::authenticationFailed);

        OtpValidationResult result = oneTimePasscodeStore.validate(user.getId(), code);
        if (!result.isValid()) {
            throw otpRejected(result.getReason());
        }
        // another verify may have consumed the same code between validate and here
        if (!oneTimePasscodeStore.invalidate(result.getOtpId())) {
            throw new AuthException(OtpValidationResult.INVALID_REASON, AuthErrorCode.OTP_INVALID);
        }
        return sessionStore.create(user.getId());
    }

    public AuthSession loginWithCredentials(String username, String password) {
        AppUser user = identityRegistry.findByUsername(username)
                .filter(AppUser::hasPassword)
                .orElseThrow(AuthException::authenticationFailed);

        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            throw AuthException.authenticationFailed();
        }
        return sessionStore.create(user.getId());
    }

    public Optional<AuthSession> currentSession(String token) {
        return sessionStore.validate(token);
    }

    public boolean logout(String token) {
        return sessionStore.invalidate(token);
    }

    public int logoutEverywhere(UUID userId) {
        int removed = sessionStore.invalidateAllForUser(userId);
        log.info("Signed out user {} from {} session(s)", userId, removed);
        return removed;
    }

    private static AuthException otpRejected(String reason) {
        AuthErrorCode code = reason.toLowerCase(Locale.ROOT).contains("expired")
                ? AuthErrorCode.OTP_EXPIRED
                : AuthErrorCode.OTP_INVALID;
        return new AuthException(reason, code);
    }

    static String maskMobileNumber(String mobileNumber) {
        if (mobileNumber == null || mobileNumber.length() <= 4) {
            return "****";
        }
        return "*".repeat(mobileNumber.length() - 4) + mobileNumber.substring(mobileNumber.length() - 4);
    }
}
