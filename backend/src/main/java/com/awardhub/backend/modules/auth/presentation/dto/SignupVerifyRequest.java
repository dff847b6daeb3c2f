package com.awardhub.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record SignupVerifyRequest(
        @NotNull(message = "verificationId is required") UUID verificationId,
        @NotBlank(message = "code is required") @Pattern(regexp = "^[0-9]{6}$", message = "code must be 6 digits") String code,
        String deviceId
) {
}
