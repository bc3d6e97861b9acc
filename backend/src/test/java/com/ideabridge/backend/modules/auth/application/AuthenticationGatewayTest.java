package com.ideabridge.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.ideabridge.backend.global.error.AuthErrorCode;
import com.ideabridge.backend.global.error.AuthException;
import com.ideabridge.backend.global.error.RateLimitedException;
import com.ideabridge.backend.modules.auth.domain.AuthSession;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AuthenticationGatewayTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private AuthenticationService authenticationService;

    @Mock
    private LoginRateLimiter loginRateLimiter;

    @InjectMocks
    private AuthenticationGateway gateway;

    @Test
    void successfulLoginIsRecordedWithUser() {
        AuthSession session = session();
        when(loginRateLimiter.isRateLimited("alice")).thenReturn(false);
        when(authenticationService.loginWithCredentials("alice", "password123")).thenReturn(session);

        assertThat(gateway.loginWithCredentials("alice", "password123")).isSameAs(session);
        verify(loginRateLimiter).recordAttempt("alice", true, USER_ID);
    }

    @Test
    void failedLoginIsRecordedAndRethrown() {
        AuthException failure = AuthException.authenticationFailed();
        when(loginRateLimiter.isRateLimited("alice")).thenReturn(false);
        when(authenticationService.loginWithCredentials("alice", "bad")).thenThrow(failure);

        AuthException thrown = catchThrowableOfType(() -> gateway.loginWithCredentials("alice", "bad"), AuthException.class);

        assertThat(thrown).isSameAs(failure);
        verify(loginRateLimiter).recordAttempt("alice", false, null);
    }

    @Test
    @DisplayName("a blocked caller is rejected before the service runs and the attempt still counts")
    void blockedLoginNeverReachesService() {
        when(loginRateLimiter.isRateLimited("alice")).thenReturn(true);
        when(loginRateLimiter.retryAfter("alice")).thenReturn(Duration.ofMinutes(12));

        RateLimitedException ex = catchThrowableOfType(
                () -> gateway.loginWithCredentials("alice", "password123"), RateLimitedException.class);

        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.RATE_LIMIT_EXCEEDED);
        assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(ex.getReason()).isEqualTo("Too many attempts. Please try again later.");
        assertThat(ex.getRetryAfterSeconds()).isEqualTo(720);
        verify(loginRateLimiter).recordAttempt("alice", false, null);
        verifyNoInteractions(authenticationService);
    }

    @Test
    void successfulOtpRequestRecordsNothing() {
        when(loginRateLimiter.isRateLimited("+1555000111")).thenReturn(false);

        gateway.requestOtp("+1555000111");

        verify(authenticationService).requestOtp("+1555000111");
        verify(loginRateLimiter, never()).recordAttempt(anyString(), anyBoolean(), any());
    }

    @Test
    void failedOtpRequestCountsAsFailure() {
        when(loginRateLimiter.isRateLimited("+1555000111")).thenReturn(false);
        doThrow(AuthException.authenticationFailed()).when(authenticationService).requestOtp("+1555000111");

        catchThrowableOfType(() -> gateway.requestOtp("+1555000111"), AuthException.class);

        verify(loginRateLimiter).recordAttempt("+1555000111", false, null);
    }

    @Test
    void verifiedOtpIsRecordedWithUser() {
        AuthSession session = session();
        when(loginRateLimiter.isRateLimited("+1555000111")).thenReturn(false);
        when(authenticationService.verifyOtp("+1555000111", "123456")).thenReturn(session);

        assertThat(gateway.verifyOtp("+1555000111", "123456")).isSameAs(session);
        verify(loginRateLimiter).recordAttempt("+1555000111", true, USER_ID);
    }

    @Test
    @DisplayName("a non-authentication failure still counts as a failed attempt and propagates unchanged")
    void storageFailureIsRecordedAndRethrown() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");
        when(loginRateLimiter.isRateLimited("+1555000111")).thenReturn(false);
        doThrow(failure).when(authenticationService).requestOtp("+1555000111");

        Throwable thrown = catchThrowable(() -> gateway.requestOtp("+1555000111"));

        assertThat(thrown).isSameAs(failure);
        verify(loginRateLimiter).recordAttempt("+1555000111", false, null);
    }

    @Test
    void overlongIdentifierIsRecordedAsGiven() {
        String username = "a".repeat(200);
        when(loginRateLimiter.isRateLimited(username)).thenReturn(false);
        when(authenticationService.loginWithCredentials(username, "x")).thenThrow(AuthException.authenticationFailed());

        AuthException ex = catchThrowableOfType(() -> gateway.loginWithCredentials(username, "x"), AuthException.class);

        assertThat(ex.getCode()).isEqualTo(AuthErrorCode.AUTH_FAILED);
        verify(loginRateLimiter).recordAttempt(username, false, null);
    }

    @Test
    @DisplayName("attempts without an identifier are counted under a shared key")
    void missingIdentifierUsesSharedKey() {
        when(loginRateLimiter.isRateLimited(AuthenticationGateway.MISSING_IDENTIFIER)).thenReturn(false);
        when(authenticationService.loginWithCredentials(null, "x")).thenThrow(AuthException.authenticationFailed());

        catchThrowableOfType(() -> gateway.loginWithCredentials(null, "x"), AuthException.class);

        verify(loginRateLimiter).recordAttempt(AuthenticationGateway.MISSING_IDENTIFIER, false, null);
    }

    private static AuthSession session() {
        OffsetDateTime now = OffsetDateTime.parse("2025-01-01T00:00:00Z");
        return new AuthSession(UUID.randomUUID(), USER_ID, "token", now.plusDays(7), now, null);
    }
}
