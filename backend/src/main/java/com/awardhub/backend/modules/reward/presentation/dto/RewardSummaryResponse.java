package com.awardhub.backend.modules.reward.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RewardSummaryResponse(
        UUID id,
        String name,
        String description,
        String imageUrl,
        long applicationsCount,
        OffsetDateTime createdAt
) {
}
