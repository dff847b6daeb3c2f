package com.awardhub.backend.modules.auth.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;

import org.junit.jupiter.api.Test;

class PhoneVerificationTest {

    private static final OffsetDateTime ISSUED = OffsetDateTime.parse("2025-03-01T10:00:00Z");

    @Test
    void validForFiveMinutes() {
        PhoneVerification verification = new PhoneVerification("+998901234567", "123456", VerificationPurpose.SIGNUP, ISSUED);

        assertThat(verification.getExpiresAt()).isEqualTo(ISSUED.plusMinutes(5));
        assertThat(verification.isValid(ISSUED.plusMinutes(4).plusSeconds(59))).isTrue();
        assertThat(verification.isValid(ISSUED.plusMinutes(5))).isFalse();
    }

    @Test
    void usableOnlyOnce() {
        PhoneVerification verification = new PhoneVerification("+998901234567", "123456", VerificationPurpose.SIGNUP, ISSUED);
        AppUser owner = new AppUser();

        verification.consumeFor(owner);

        assertThat(verification.isUsed()).isTrue();
        assertThat(verification.getUser()).isSameAs(owner);
        assertThat(verification.isValid(ISSUED.plusMinutes(1))).isFalse();
    }

    @Test
    void matchesExactCodeOnly() {
        PhoneVerification verification = new PhoneVerification("+998901234567", "012345", VerificationPurpose.RESET, ISSUED);

        assertThat(verification.matches("012345")).isTrue();
        assertThat(verification.matches("12345")).isFalse();
        assertThat(verification.matches(null)).isFalse();
    }
}
