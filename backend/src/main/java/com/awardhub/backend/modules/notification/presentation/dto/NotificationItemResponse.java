package com.awardhub.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.awardhub.backend.modules.notification.domain.NotificationType;

public record NotificationItemResponse(
        UUID id,
        NotificationType type,
        String title,
        OffsetDateTime createdAt,
        boolean read,
        String timeSince
) {
}
