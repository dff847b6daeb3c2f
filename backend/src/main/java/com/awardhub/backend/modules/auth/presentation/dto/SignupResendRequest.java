package com.awardhub.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record SignupResendRequest(@NotNull(message = "verificationId is required") UUID verificationId) {
}
