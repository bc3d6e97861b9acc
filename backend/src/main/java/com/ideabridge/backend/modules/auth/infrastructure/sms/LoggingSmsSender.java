package com.ideabridge.backend.modules.auth.infrastructure.sms;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.ideabridge.backend.modules.auth.application.SmsSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Development transport: writes the code to the log instead of sending it and keeps a bounded outbox
 * of the most recent messages so local tooling can read them.
 * <p>
 * Note: Bean is created by {@link SmsSenderConfig} when {@code auth.sms.provider=mock}.
 */
public class LoggingSmsSender implements SmsSender {

    private static final Logger logger = LoggerFactory.getLogger(LoggingSmsSender.class);

    static final int DEFAULT_OUTBOX_CAPACITY = 100;

    private final Clock clock;
    private final int capacity;
    private final Deque<SentMessage> outbox = new ArrayDeque<>();

    public LoggingSmsSender(Clock clock) {
        this(clock, DEFAULT_OUTBOX_CAPACITY);
    }

    /**
     * @param capacity number of most recent messages kept; older ones are dropped
     */
    public LoggingSmsSender(Clock clock, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.clock = clock;
        this.capacity = capacity;
    }

    @Override
    public void sendOtp(String mobileNumber, String code) {
        synchronized (outbox) {
            if (outbox.size() == capacity) {
                outbox.removeFirst();
            }
            outbox.addLast(new SentMessage(mobileNumber, code, OffsetDateTime.now(clock)));
        }
        logger.info("[SMS Bypass] OTP for {} is {}", mobileNumber, code);
    }

    public List<SentMessage> getSentMessages() {
        synchronized (outbox) {
            return List.copyOf(outbox);
        }
    }

    public Optional<SentMessage> getLastMessage() {
        synchronized (outbox) {
            return Optional.ofNullable(outbox.peekLast());
        }
    }

    public boolean wasOtpSent(String mobileNumber, String code) {
        synchronized (outbox) {
            return outbox.stream().anyMatch(m -> m.mobileNumber().equals(mobileNumber) && m.code().equals(code));
        }
    }

    public void clear() {
        synchronized (outbox) {
            outbox.clear();
        }
    }

    public record SentMessage(String mobileNumber, String code, OffsetDateTime sentAt) {
    }
}
