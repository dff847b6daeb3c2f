package com.awardhub.backend.modules.notification.presentation.dto;

public record NotificationCountsResponse(long totalCount, long unreadCount, long readCount) {

    public static NotificationCountsResponse of(long total, long unread) {
        return new NotificationCountsResponse(total, unread, total - unread);
    }
}
