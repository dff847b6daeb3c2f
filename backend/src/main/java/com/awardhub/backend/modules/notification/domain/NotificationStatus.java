package com.awardhub.backend.modules.notification.domain;

/**
 * Delivery status. In-app notifications are stored as {@link #SENT}; the other values are kept for
 * outbound channels.
 */
public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED,
    CANCELLED
}
