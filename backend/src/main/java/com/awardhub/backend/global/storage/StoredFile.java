package com.awardhub.backend.global.storage;

public record StoredFile(String path, String originalName, long size) {
}
