package com.awardhub.backend.modules.auth.application;

import java.security.SecureRandom;

import org.springframework.stereotype.Component;

@Component
public class OtpCodeGenerator {

    private static final int CODE_LENGTH = 6;

    private final SecureRandom random = new SecureRandom();

    public String nextCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(random.nextInt(10));
        }
        return sb.toString();
    }
}
