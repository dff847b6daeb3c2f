package com.awardhub.backend.modules.auth.presentation.dto;

import java.time.LocalDate;

import com.awardhub.backend.modules.auth.domain.Gender;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update; null fields are left untouched.
 */
public record UpdateProfileRequest(
        @Size(min = 1, max = 50) @Pattern(regexp = "(?s).*\\S.*", message = "firstName must not be blank") String firstName,
        @Size(min = 1, max = 50) @Pattern(regexp = "(?s).*\\S.*", message = "lastName must not be blank") String lastName,
        @Size(max = 50) String otherName,
        Gender gender,
        @Email(message = "email must be a valid address") @Size(max = 100) String email,
        @Pattern(regexp = PhonePatterns.PHONE_NUMBER, message = "phoneNumber must contain 7 to 15 digits") String phoneNumber,
        @Past(message = "Birth date must be before today") LocalDate birthDate,
        @Size(max = 2000) String address,
        @Size(max = 2000) String workingPlace
) {
}
