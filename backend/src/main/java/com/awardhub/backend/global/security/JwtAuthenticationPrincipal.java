package com.awardhub.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String phoneNumber, List<String> roles) {

    public boolean isStaff() {
        return roles.contains(SecurityUtils.ROLE_STAFF);
    }
}
