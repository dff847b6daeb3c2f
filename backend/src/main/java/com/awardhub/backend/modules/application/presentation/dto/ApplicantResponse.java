package com.awardhub.backend.modules.application.presentation.dto;

import java.util.UUID;

import com.awardhub.backend.modules.auth.domain.AppUser;

public record ApplicantResponse(UUID userId, String firstName, String lastName, String pinfl, String phoneNumber) {

    public static ApplicantResponse from(AppUser user) {
        return new ApplicantResponse(user.getId(), user.getFirstName(), user.getLastName(), user.getPinfl(),
                user.getPhoneNumber());
    }
}
