package com.ideabridge.backend.modules.auth.infrastructure.sms;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;

import com.ideabridge.backend.modules.auth.application.SmsSender;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class SmsSenderConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withBean(Clock.class, Clock::systemUTC)
            .withUserConfiguration(SmsSenderConfig.class);

    @Test
    void defaultsToLoggingSender() {
        contextRunner.run(context -> assertThat(context.getBean(SmsSender.class)).isInstanceOf(LoggingSmsSender.class));
    }

    @Test
    void twilioProviderBuildsTwilioSender() {
        contextRunner
                .withPropertyValues(
                        "auth.sms.provider=twilio",
                        "twilio.account-sid=AC00000000000000000000000000000000",
                        "twilio.auth-token=token",
                        "twilio.phone-number=+15550001111"
                )
                .run(context -> assertThat(context.getBean(SmsSender.class)).isInstanceOf(TwilioSmsSender.class));
    }

    @Test
    void twilioProviderWithoutCredentialsFailsStartup() {
        contextRunner
                .withPropertyValues("auth.sms.provider=twilio")
                .run(context -> assertThat(context).hasFailed());
    }
}
