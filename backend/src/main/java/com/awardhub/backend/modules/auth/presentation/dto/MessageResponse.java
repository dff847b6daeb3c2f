package com.awardhub.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
