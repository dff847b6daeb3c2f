package com.awardhub.backend.modules.auth.domain;

public enum Gender {
    MALE,
    FEMALE
}
