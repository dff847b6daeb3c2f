package com.awardhub.backend.modules.notification.presentation.dto;

public record MarkAllReadResponse(String message, int updatedCount, long totalUnreadBefore) {
}
