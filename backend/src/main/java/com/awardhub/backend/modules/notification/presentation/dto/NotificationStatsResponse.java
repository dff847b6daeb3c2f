package com.awardhub.backend.modules.notification.presentation.dto;

import java.util.List;
import java.util.Map;

public record NotificationStatsResponse(
        long totalCount,
        long unreadCount,
        long readCount,
        Map<String, Long> byType,
        List<NotificationItemResponse> recent
) {
}
