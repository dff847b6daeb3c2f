package com.awardhub.backend.modules.application.presentation.dto;

import com.awardhub.backend.modules.application.domain.ApplicationStatus;

import jakarta.validation.constraints.NotNull;

public record UpdateApplicationStatusRequest(@NotNull(message = "status is required") ApplicationStatus status) {
}
