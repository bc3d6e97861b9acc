package com.ideabridge.backend.modules.auth.infrastructure.sms;

import com.ideabridge.backend.modules.auth.application.SmsDeliveryException;
import com.ideabridge.backend.modules.auth.application.SmsSender;
import com.twilio.exception.ApiException;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends passcodes through the Twilio Messages API.
 * <p>
 * Holds its own {@link TwilioRestClient}; the static {@code Twilio.init} client is never touched.
 * <p>
 * Note: Bean is created by {@link SmsSenderConfig} when {@code auth.sms.provider=twilio}.
 */
public class TwilioSmsSender implements SmsSender {

    private static final Logger logger = LoggerFactory.getLogger(TwilioSmsSender.class);

    static final String MESSAGE_TEMPLATE = "Your verification code is: %s. This code will expire in %d minutes.";

    private final TwilioRestClient client;
    private final PhoneNumber from;
    private final int expiryMinutes;

    public TwilioSmsSender(TwilioRestClient client, String fromNumber, int expiryMinutes) {
        this.client = client;
        this.from = new PhoneNumber(fromNumber);
        this.expiryMinutes = expiryMinutes;
    }

    @Override
    public void sendOtp(String mobileNumber, String code) {
        String body = String.format(MESSAGE_TEMPLATE, code, expiryMinutes);
        try {
            Message message = Message.creator(new PhoneNumber(mobileNumber), from, body).create(client);
            logger.info("OTP sent to {} via Twilio: SID {}, status {}", mobileNumber, message.getSid(), message.getStatus());
        } catch (ApiException e) {
            logger.error("Twilio rejected OTP message to {}: {} (code: {})", mobileNumber, e.getMessage(), e.getCode(), e);
            throw new SmsDeliveryException("Failed to send OTP via Twilio", e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error sending OTP to {} via Twilio", mobileNumber, e);
            throw new SmsDeliveryException("Failed to send OTP via Twilio", e);
        }
    }
}
