package com.awardhub.backend.modules.application.presentation.dto;

import com.awardhub.backend.modules.application.domain.Area;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record PersonalInfoRequest(
        @NotBlank(message = "firstName is required") @Size(max = 50) String firstName,
        @NotBlank(message = "lastName is required") @Size(max = 50) String lastName,
        @NotBlank(message = "pinfl is required") @Pattern(regexp = "^[0-9]{14}$", message = "PINFL must be exactly 14 digits") String pinfl,
        @NotBlank(message = "phoneNumber is required")
        @Pattern(regexp = "^\\+?[0-9]{9,15}$", message = "Phone number must contain at least 9 digits")
        String phoneNumber,
        @NotNull(message = "area is required") Area area,
        @NotBlank(message = "district is required") @Size(max = 200) String district,
        @NotBlank(message = "neighborhood is required") @Size(max = 200) String neighborhood
) {
}
