package com.awardhub.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SignupStartResponse(UUID verificationId, String phoneNumber, OffsetDateTime expiresAt, String message) {
}
