package com.awardhub.backend.modules.auth.application;

import com.awardhub.backend.modules.auth.infrastructure.sms.SmsDeliveryException;
import com.awardhub.backend.modules.auth.infrastructure.sms.SmsGateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

/**
 * Retrying wrapper around the SMS transport. Exhausted retries are logged and dropped.
 */
@Component
public class SmsDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(SmsDeliveryService.class);

    private final SmsGateway smsGateway;

    public SmsDeliveryService(SmsGateway smsGateway) {
        this.smsGateway = smsGateway;
    }

    @Retryable(
            retryFor = SmsDeliveryException.class,
            maxAttemptsExpression = "${awardhub.sms.max-attempts:4}",
            backoff = @Backoff(delayExpression = "${awardhub.sms.backoff-ms:5000}")
    )
    public void deliver(String phoneNumber, String message) {
        smsGateway.send(phoneNumber, message);
    }

    @Recover
    public void giveUp(SmsDeliveryException ex, String phoneNumber, String message) {
        log.error("SMS delivery failed after retries", ex);
    }
}
