package com.awardhub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record PasswordResetRequest(
        @NotBlank(message = "phoneNumber is required") String phoneNumber,
        @NotBlank(message = "code is required") @Pattern(regexp = "^[0-9]{6}$", message = "code must be 6 digits") String code,
        @NotBlank(message = "newPassword is required") @Size(min = 8, max = 128, message = "newPassword must be at least 8 characters") String newPassword
) {
}
