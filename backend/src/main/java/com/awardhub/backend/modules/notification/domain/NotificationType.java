package com.awardhub.backend.modules.notification.domain;

public enum NotificationType {
    APPLICATION_CREATED,
    APPLICATION_UPDATED,
    APPLICATION_REJECTED,
    REWARD_WON
}
