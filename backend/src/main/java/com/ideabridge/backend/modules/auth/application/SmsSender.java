package com.ideabridge.backend.modules.auth.application;

/**
 * Out-of-band delivery of one-time passcodes.
 * <p>
 * Implementations deliver or throw. The authentication core treats any exception as a failed
 * delivery and does not look at transport-specific details.
 */
public interface SmsSender {

    /**
     * @param mobileNumber destination in E.164 format
     * @param code the six-digit passcode
     * @throws SmsDeliveryException (or any runtime exception) if the message could not be handed off
     */
    void sendOtp(String mobileNumber, String code);
}
