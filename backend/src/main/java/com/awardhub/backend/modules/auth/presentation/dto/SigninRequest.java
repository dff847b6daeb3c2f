package com.awardhub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record SigninRequest(
        @NotBlank(message = "phoneNumber is required") String phoneNumber,
        @NotBlank(message = "password is required") String password,
        String deviceId
) {
}
