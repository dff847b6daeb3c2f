package com.awardhub.backend.modules.auth.infrastructure.sms;

/**
 * Outbound SMS transport. Implementations throw {@link SmsDeliveryException} for failures worth retrying.
 */
public interface SmsGateway {

    void send(String phoneNumber, String message);
}
