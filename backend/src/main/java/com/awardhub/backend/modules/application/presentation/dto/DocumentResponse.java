package com.awardhub.backend.modules.application.presentation.dto;

import com.awardhub.backend.modules.application.domain.StagedDocument;

public record DocumentResponse(String originalName, long size) {

    public static DocumentResponse from(StagedDocument document) {
        return document == null ? null : new DocumentResponse(document.originalName(), document.size());
    }
}
