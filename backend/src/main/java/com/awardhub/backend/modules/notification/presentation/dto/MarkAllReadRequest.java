package com.awardhub.backend.modules.notification.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.Size;

/**
 * Empty or missing {@code notificationIds} means every unread notification.
 */
public record MarkAllReadRequest(@Size(max = 500, message = "At most 500 ids per request") List<UUID> notificationIds) {
}
