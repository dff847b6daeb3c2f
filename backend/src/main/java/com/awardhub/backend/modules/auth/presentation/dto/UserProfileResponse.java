package com.awardhub.backend.modules.auth.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.auth.domain.Gender;

public record UserProfileResponse(
        UUID id,
        String email,
        String phoneNumber,
        String firstName,
        String lastName,
        String otherName,
        Gender gender,
        LocalDate birthDate,
        String address,
        String workingPlace,
        String pinfl,
        String passportNumber,
        String profilePicture,
        boolean isStaff,
        List<String> roles,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getPhoneNumber(),
                user.getFirstName(),
                user.getLastName(),
                user.getOtherName(),
                user.getGender(),
                user.getBirthDate(),
                user.getAddress(),
                user.getWorkingPlace(),
                user.getPinfl(),
                user.getPassportNumber(),
                user.getProfilePicture(),
                user.isStaff() || user.isSuperuser(),
                user.roleCodes(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
