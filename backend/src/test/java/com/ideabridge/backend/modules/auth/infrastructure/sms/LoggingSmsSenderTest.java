package com.ideabridge.backend.modules.auth.infrastructure.sms;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class LoggingSmsSenderTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    private final LoggingSmsSender sender = new LoggingSmsSender(Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));

    @Test
    void keepsSentCodesInOutbox() {
        sender.sendOtp("+1555000111", "123456");
        sender.sendOtp("+1555000222", "654321");

        assertThat(sender.getSentMessages()).hasSize(2);
        assertThat(sender.getLastMessage()).hasValueSatisfying(message -> {
            assertThat(message.mobileNumber()).isEqualTo("+1555000222");
            assertThat(message.code()).isEqualTo("654321");
            assertThat(message.sentAt()).isEqualTo(NOW);
        });
        assertThat(sender.wasOtpSent("+1555000111", "123456")).isTrue();
        assertThat(sender.wasOtpSent("+1555000111", "654321")).isFalse();
    }

    @Test
    void outboxKeepsOnlyMostRecentMessages() {
        LoggingSmsSender bounded = new LoggingSmsSender(Clock.fixed(NOW.toInstant(), ZoneOffset.UTC), 3);

        for (int i = 1; i <= 5; i++) {
            bounded.sendOtp("+155500011" + i, "00000" + i);
        }

        assertThat(bounded.getSentMessages())
                .extracting(LoggingSmsSender.SentMessage::code)
                .containsExactly("000003", "000004", "000005");
        assertThat(bounded.wasOtpSent("+1555000111", "000001")).isFalse();
        assertThat(bounded.getLastMessage()).hasValueSatisfying(message -> assertThat(message.code()).isEqualTo("000005"));
    }

    @Test
    void defaultOutboxIsBounded() {
        for (int i = 0; i < LoggingSmsSender.DEFAULT_OUTBOX_CAPACITY + 10; i++) {
            sender.sendOtp("+1555000111", String.format("%06d", i));
        }

        assertThat(sender.getSentMessages()).hasSize(LoggingSmsSender.DEFAULT_OUTBOX_CAPACITY);
    }

    @Test
    void clearEmptiesOutbox() {
        sender.sendOtp("+1555000111", "123456");

        sender.clear();

        assertThat(sender.getSentMessages()).isEmpty();
        assertThat(sender.getLastMessage()).isEmpty();
    }
}
