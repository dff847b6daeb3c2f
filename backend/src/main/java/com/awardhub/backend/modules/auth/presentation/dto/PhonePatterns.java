package com.awardhub.backend.modules.auth.presentation.dto;

public final class PhonePatterns {

    public static final String PHONE_NUMBER = "^\\+?[0-9]{7,15}$";

    private PhonePatterns() {
    }
}
