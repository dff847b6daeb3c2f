package com.awardhub.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record MarkReadResponse(UUID id, boolean read, boolean wasUnread, OffsetDateTime readAt) {
}
