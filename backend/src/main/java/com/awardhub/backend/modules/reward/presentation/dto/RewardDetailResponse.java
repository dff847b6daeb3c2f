package com.awardhub.backend.modules.reward.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RewardDetailResponse(
        UUID id,
        String name,
        String description,
        String imageUrl,
        long applicationsCount,
        long pendingApplications,
        long approvedApplications,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
