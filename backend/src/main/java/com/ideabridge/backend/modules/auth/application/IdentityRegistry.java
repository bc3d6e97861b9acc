package com.ideabridge.backend.modules.auth.application;

import java.util.Locale;
import java.util.Optional;

import com.ideabridge.backend.global.error.AuthErrorCode;
import com.ideabridge.backend.global.error.AuthException;
import com.ideabridge.backend.global.error.DuplicateIdentityException;
import com.ideabridge.backend.modules.auth.domain.AppUser;
import com.ideabridge.backend.modules.auth.domain.Identity;
import com.ideabridge.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Creates accounts from a single proof method.
 * <p>
 * Registration is one insert. Duplicates are recognised from the unique-constraint violation raised by
 * the database, never from a lookup beforehand, so two concurrent registrations of the same value
 * cannot both succeed. Methods here are intentionally not transactional: the insert runs in the
 * repository's own transaction so a violation does not poison an outer one.
 */
@Service
public class IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    static final String REGISTRATION_FAILED_MESSAGE = "Failed to register user";
    static final String USERNAME_FIELD = "Username";
    static final String MOBILE_NUMBER_FIELD = "Mobile number";

    private final AppUserRepository appUserRepository;
    private final PasswordHasher passwordHasher;

    public IdentityRegistry(AppUserRepository appUserRepository, PasswordHasher passwordHasher) {
        this.appUserRepository = appUserRepository;
        this.passwordHasher = passwordHasher;
    }

    public AppUser registerWithCredentials(String username, String plaintextPassword) {
        return registerCredentials(username, plaintextPassword, false);
    }

    /**
     * Same contract as {@link #registerWithCredentials(String, String)} with the admin flag set.
     */
    public AppUser registerAdmin(String username, String plaintextPassword) {
        return registerCredentials(username, plaintextPassword, true);
    }

    public AppUser registerWithMobile(String mobileNumber) {
        return insert(AppUser.register(new Identity.Mobile(mobileNumber)));
    }

    public Optional<AppUser> findByUsername(String username) {
        if (username == null) {
            return Optional.empty();
        }
        return appUserRepository.findByUsername(username);
    }

    public Optional<AppUser> findByMobileNumber(String mobileNumber) {
        if (mobileNumber == null) {
            return Optional.empty();
        }
        return appUserRepository.findByMobileNumber(mobileNumber);
    }

    private AppUser registerCredentials(String username, String plaintextPassword, boolean admin) {
        String passwordHash;
        try {
            passwordHash = passwordHasher.hash(plaintextPassword);
        } catch (PasswordHashingException ex) {
            log.error("Password hashing failed during registration", ex);
            throw new AuthException(REGISTRATION_FAILED_MESSAGE, AuthErrorCode.REGISTRATION_FAILED);
        }
        return insert(AppUser.register(new Identity.Credentials(username, passwordHash), admin));
    }

    private AppUser insert(AppUser user) {
        try {
            AppUser saved = appUserRepository.saveAndFlush(user);
            log.info("Registered user {} ({})", saved.getId(), proofType(user));
            return saved;
        } catch (DataIntegrityViolationException ex) {
            if (violates(ex, AppUser.UK_USERNAME)) {
                throw new DuplicateIdentityException(USERNAME_FIELD);
            }
            if (violates(ex, AppUser.UK_MOBILE_NUMBER)) {
                throw new DuplicateIdentityException(MOBILE_NUMBER_FIELD);
            }
            log.error("User registration rejected by the database: {}", ex.getMostSpecificCause().getMessage(), ex);
            throw new AuthException(REGISTRATION_FAILED_MESSAGE, AuthErrorCode.REGISTRATION_FAILED);
        } catch (DataAccessException ex) {
            log.error("User registration failed", ex);
            throw new AuthException(REGISTRATION_FAILED_MESSAGE, AuthErrorCode.REGISTRATION_FAILED);
        }
    }

    private static boolean violates(DataIntegrityViolationException ex, String constraintName) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                return violation.getConstraintName().toLowerCase(Locale.ROOT).contains(constraintName);
            }
            current = current.getCause();
        }
        String detail = ex.getMostSpecificCause().getMessage();
        return detail != null && detail.toLowerCase(Locale.ROOT).contains(constraintName);
    }

    private static String proofType(AppUser user) {
        return user.getIdentity() instanceof Identity.Credentials ? "credentials" : "mobile";
    }
}
