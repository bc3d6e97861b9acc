package com.ideabridge.backend.modules.auth.infrastructure.sms;

import java.time.Clock;

import com.ideabridge.backend.modules.auth.application.SmsSender;
import com.twilio.http.TwilioRestClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the SMS transport from {@code auth.sms.provider}.
 * <p>
 * Supported providers:
 * - "mock": {@link LoggingSmsSender}, the default, logs codes instead of sending them
 * - "twilio": {@link TwilioSmsSender}, needs {@code twilio.account-sid}, {@code twilio.auth-token}
 *   and {@code twilio.phone-number}
 */
@Configuration
public class SmsSenderConfig {

    private static final Logger logger = LoggerFactory.getLogger(SmsSenderConfig.class);

    @Bean
    @ConditionalOnProperty(name = "auth.sms.provider", havingValue = "mock", matchIfMissing = true)
    public SmsSender loggingSmsSender(Clock clock) {
        logger.info("Configuring logging SMS sender; OTP codes will only be written to the log");
        return new LoggingSmsSender(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "auth.sms.provider", havingValue = "twilio")
    public SmsSender twilioSmsSender(
            @Value("${twilio.account-sid:}") String accountSid,
            @Value("${twilio.auth-token:}") String authToken,
            @Value("${twilio.phone-number:}") String phoneNumber,
            @Value("${auth.otp.expiry-minutes:5}") int expiryMinutes) {
        if (accountSid.isBlank() || authToken.isBlank() || phoneNumber.isBlank()) {
            throw new IllegalStateException(
                    "Twilio configuration missing. Required: twilio.account-sid, twilio.auth-token, twilio.phone-number");
        }
        logger.info("Configuring Twilio SMS sender from {}", phoneNumber);
        TwilioRestClient client = new TwilioRestClient.Builder(accountSid, authToken).build();
        return new TwilioSmsSender(client, phoneNumber, expiryMinutes);
    }
}
