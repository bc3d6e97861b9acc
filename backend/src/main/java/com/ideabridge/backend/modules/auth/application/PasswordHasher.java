package com.ideabridge.backend.modules.auth.application;

import java.util.Objects;
import java.util.regex.Pattern;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted one-way hashing of passwords. Both operations are deliberately slow (BCrypt); callers must not
 * hold locks around them.
 */
@Component
public class PasswordHasher {

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2(a|y|b)?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String password) {
        Objects.requireNonNull(password, "password is required");
        try {
            return passwordEncoder.encode(password);
        } catch (RuntimeException ex) {
            throw new PasswordHashingException("Failed to hash password", ex);
        }
    }

    /**
     * @throws PasswordHashingException when the stored value is not a BCrypt hash
     */
    public boolean verify(String password, String hashedValue) {
        if (hashedValue == null || !BCRYPT_PATTERN.matcher(hashedValue).matches()) {
            throw new PasswordHashingException("Stored password hash is malformed");
        }
        if (password == null) {
            return false;
        }
        try {
            return passwordEncoder.matches(password, hashedValue);
        } catch (RuntimeException ex) {
            throw new PasswordHashingException("Failed to compare password", ex);
        }
    }
}
