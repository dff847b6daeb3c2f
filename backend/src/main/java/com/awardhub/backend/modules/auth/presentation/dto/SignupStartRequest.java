package com.awardhub.backend.modules.auth.presentation.dto;

import java.time.LocalDate;

import com.awardhub.backend.modules.auth.domain.Gender;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record SignupStartRequest(
        @NotBlank(message = "firstName is required") @Size(max = 50) String firstName,
        @NotBlank(message = "lastName is required") @Size(max = 50) String lastName,
        @NotBlank(message = "otherName is required") @Size(max = 50) String otherName,
        @NotNull(message = "gender is required") Gender gender,
        @NotBlank(message = "email is required") @Email(message = "email must be a valid address") @Size(max = 100) String email,
        @NotBlank(message = "phoneNumber is required")
        @Pattern(regexp = PhonePatterns.PHONE_NUMBER, message = "phoneNumber must contain 7 to 15 digits")
        String phoneNumber,
        @NotBlank(message = "password is required") @Size(min = 8, max = 128, message = "password must be at least 8 characters") String password,
        @NotBlank(message = "passwordConfirm is required") String passwordConfirm,
        @NotNull(message = "birthDate is required") @Past(message = "Birth date must be before today") LocalDate birthDate,
        @NotBlank(message = "address is required") @Size(max = 2000) String address,
        @Size(max = 2000, message = "Working place must be less than 2000 characters") String workingPlace,
        @NotBlank(message = "pinfl is required") @Pattern(regexp = "^[0-9]{14}$", message = "PINFL must be exactly 14 digits") String pinfl,
        @NotBlank(message = "passportNumber is required")
        @Pattern(regexp = "^[A-Za-z]{2}[0-9]{7}$", message = "Passport number must be 2 letters followed by 7 digits")
        String passportNumber
) {
}
