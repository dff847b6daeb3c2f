package com.awardhub.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.modules.notification.domain.NotificationStatus;
import com.awardhub.backend.modules.notification.domain.NotificationType;

/**
 * {@code wasMarkedAsRead} is true when this request was the first to open the notification.
 */
public record NotificationDetailResponse(
        UUID id,
        NotificationType type,
        String title,
        NotificationStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime sentAt,
        OffsetDateTime readAt,
        boolean read,
        Map<String, Object> extraData,
        ApplicationSnapshotResponse source,
        String timeSince,
        boolean wasMarkedAsRead
) {
}
