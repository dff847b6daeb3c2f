package com.awardhub.backend.modules.application.presentation.dto;

import java.util.List;

import com.awardhub.backend.modules.application.domain.ApplicationDraft.Documents;

public record DocumentsResponse(
        DocumentResponse recommendationLetter,
        List<DocumentResponse> certificates,
        List<DocumentResponse> files
) {

    public static DocumentsResponse from(Documents documents) {
        if (documents == null) {
            return null;
        }
        return new DocumentsResponse(
                DocumentResponse.from(documents.recommendationLetter()),
                documents.certificates().stream().map(DocumentResponse::from).toList(),
                documents.files().stream().map(DocumentResponse::from).toList()
        );
    }
}
