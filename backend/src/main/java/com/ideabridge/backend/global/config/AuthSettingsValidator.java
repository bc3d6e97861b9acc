package com.ideabridge.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks authentication settings once the application is up and refuses to keep running with values
 * that would make the flows misbehave.
 */
@Component
public class AuthSettingsValidator {

    private static final Logger log = LoggerFactory.getLogger(AuthSettingsValidator.class);

    private static final Pattern E164 = Pattern.compile("^\\+[1-9]\\d{1,14}$");

    static final List<String> POSITIVE_INT_SETTINGS = List.of(
            "auth.session.expiry-days",
            "auth.otp.expiry-minutes",
            "auth.rate-limit.attempts",
            "auth.rate-limit.window-minutes"
    );

    static final List<String> TWILIO_SETTINGS = List.of(
            "twilio.account-sid",
            "twilio.auth-token",
            "twilio.phone-number"
    );

    private final Environment environment;

    public AuthSettingsValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateSettings() {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String key : POSITIVE_INT_SETTINGS) {
            property(key).ifPresent(value -> {
                try {
                    if (Integer.parseInt(value) <= 0) {
                        invalid.add(key + ": must be a positive integer");
                    }
                } catch (NumberFormatException e) {
                    invalid.add(key + ": must be a positive integer");
                }
            });
        }

        String provider = property("auth.sms.provider").orElse("mock").toLowerCase(Locale.ROOT);
        switch (provider) {
            case "mock" -> {
            }
            case "twilio" -> {
                for (String key : TWILIO_SETTINGS) {
                    if (property(key).isEmpty()) {
                        missing.add(key);
                    }
                }
                property("twilio.phone-number")
                        .filter(number -> !E164.matcher(number).matches())
                        .ifPresent(number -> invalid.add("twilio.phone-number: must be in E.164 format (e.g. +1234567890)"));
            }
            default -> invalid.add("auth.sms.provider: must be 'mock' or 'twilio'");
        }

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            if (!missing.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missing));
            }
            invalid.forEach(problem -> log.error("Invalid setting {}", problem));
            throw new IllegalStateException("Authentication settings are invalid: "
                    + String.join("; ", concat(missing, invalid)));
        }

        log.info("Authentication settings validated (sms provider: {})", provider);
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private static List<String> concat(List<String> missing, List<String> invalid) {
        List<String> all = new ArrayList<>(missing.size() + invalid.size());
        missing.forEach(key -> all.add(key + ": missing"));
        all.addAll(invalid);
        return all;
    }
}
