package com.awardhub.backend.modules.auth.domain;

public enum VerificationPurpose {
    SIGNUP,
    LOGIN,
    RESET
}
