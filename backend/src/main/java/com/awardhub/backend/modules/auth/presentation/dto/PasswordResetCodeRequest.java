package com.awardhub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetCodeRequest(@NotBlank(message = "phoneNumber is required") String phoneNumber) {
}
