package com.awardhub.backend.modules.auth.domain;

import java.time.LocalDate;

/**
 * Registration form held in the cache between code dispatch and verification.
 * The password is already hashed; the plain value never leaves the request.
 */
public record PendingSignup(
        String firstName,
        String lastName,
        String otherName,
        Gender gender,
        String email,
        String phoneNumber,
        String passwordHash,
        LocalDate birthDate,
        String address,
        String workingPlace,
        String pinfl,
        String passportNumber
) {

    public AppUser toUser() {
        AppUser user = new AppUser();
        user.setFirstName(firstName);
        user.setLastName(lastName);
        user.setOtherName(otherName);
        user.setGender(gender);
        user.setEmail(email);
        user.setPhoneNumber(phoneNumber);
        user.setPasswordHash(passwordHash);
        user.setBirthDate(birthDate);
        user.setAddress(address);
        user.setWorkingPlace(workingPlace);
        user.setPinfl(pinfl);
        user.setPassportNumber(passportNumber);
        return user;
    }
}
