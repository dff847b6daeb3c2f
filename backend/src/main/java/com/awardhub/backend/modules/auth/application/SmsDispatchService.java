package com.awardhub.backend.modules.auth.application;

import com.awardhub.backend.global.config.AsyncConfig;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget SMS dispatch. Callers never wait for, or observe, delivery.
 */
@Service
public class SmsDispatchService {

    static final String VERIFICATION_TEMPLATE = "Your verification code is: %s. Valid for 5 minutes.";
    static final String RESET_TEMPLATE = "Your password reset code is: %s. Valid for 5 minutes.";

    private final SmsDeliveryService smsDeliveryService;

    public SmsDispatchService(SmsDeliveryService smsDeliveryService) {
        this.smsDeliveryService = smsDeliveryService;
    }

    @Async(AsyncConfig.SMS_EXECUTOR)
    public void sendVerificationCode(String phoneNumber, String code) {
        smsDeliveryService.deliver(phoneNumber, VERIFICATION_TEMPLATE.formatted(code));
    }

    @Async(AsyncConfig.SMS_EXECUTOR)
    public void sendPasswordResetCode(String phoneNumber, String code) {
        smsDeliveryService.deliver(phoneNumber, RESET_TEMPLATE.formatted(code));
    }
}
