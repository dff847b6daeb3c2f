package com.awardhub.backend.modules.application.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ActivityInfoRequest(
        @NotBlank(message = "activity is required") @Size(max = 200, message = "activity must be at most 200 characters") String activity,
        @NotBlank(message = "activityDescription is required") String activityDescription
) {
}
