package com.ideabridge.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

class PasswordHasherTest {

    private PasswordHasher passwordHasher;

    @BeforeEach
    void setUp() {
        passwordHasher = new PasswordHasher(new BCryptPasswordEncoder(4));
    }

    @Test
    @DisplayName("hash never equals the plaintext and verifies against it")
    void hashVerifiesAgainstOriginalPassword() {
        String hash = passwordHasher.hash("password123");

        assertThat(hash).isNotEqualTo("password123").startsWith("$2");
        assertThat(passwordHasher.verify("password123", hash)).isTrue();
    }

    @Test
    @DisplayName("a different password does not verify")
    void wrongPasswordDoesNotVerify() {
        String hash = passwordHasher.hash("password123");

        assertThat(passwordHasher.verify("password124", hash)).isFalse();
        assertThat(passwordHasher.verify("", hash)).isFalse();
    }

    @Test
    void sameInputHashesDifferentlyEachTime() {
        String first = passwordHasher.hash("secret");
        String second = passwordHasher.hash("secret");

        assertThat(first).isNotEqualTo(second);
        assertThat(passwordHasher.verify("secret", first)).isTrue();
        assertThat(passwordHasher.verify("secret", second)).isTrue();
    }

    @Test
    void emptyPasswordIsHashable() {
        String hash = passwordHasher.hash("");

        assertThat(passwordHasher.verify("", hash)).isTrue();
    }

    @Test
    @DisplayName("a malformed stored hash is a hashing failure, not a mismatch")
    void malformedStoredHashFails() {
        assertThatThrownBy(() -> passwordHasher.verify("password123", "not-a-bcrypt-hash"))
                .isInstanceOf(PasswordHashingException.class);
        assertThatThrownBy(() -> passwordHasher.verify("password123", null))
                .isInstanceOf(PasswordHashingException.class);
    }

    @Test
    @DisplayName("a null password is a caller error, not a hashing failure")
    void nullPasswordIsRejected() {
        assertThatThrownBy(() -> passwordHasher.hash(null))
                .isInstanceOf(NullPointerException.class)
                .isNotInstanceOf(PasswordHashingException.class);
    }

    @Test
    void encoderFailureIsWrapped() {
        PasswordEncoder broken = mock(PasswordEncoder.class);
        when(broken.encode(anyString())).thenThrow(new IllegalStateException("no entropy"));
        PasswordHasher hasher = new PasswordHasher(broken);

        assertThatThrownBy(() -> hasher.hash("password123"))
                .isInstanceOf(PasswordHashingException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
