package com.awardhub.backend.modules.application.domain;

/**
 * Metadata of an upload sitting in temporary storage. The bytes are never cached.
 */
public record StagedDocument(String path, String originalName, long size) {
}
