package com.awardhub.backend.modules.application.presentation.dto;

import java.util.UUID;

public record AttachmentResponse(UUID id, String url, String originalName, long size) {
}
