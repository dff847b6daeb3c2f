package com.awardhub.backend.global.storage;

import org.springframework.web.multipart.MultipartFile;

/**
 * Two-area file store: a private staging area for uploads that are not yet attached
 * to a record, and a public media area served under {@code /media/**}.
 */
public interface FileStorage {

    StoredFile stageTemporary(String ownerKey, MultipartFile file);

    boolean temporaryExists(String temporaryPath);

    /**
     * Copies a staged file into the media area. The staged copy is left in place.
     *
     * @return the media-relative path of the copy
     */
    String promote(String temporaryPath, String directory);

    String store(String directory, MultipartFile file);

    void deleteTemporary(String temporaryPath);

    void delete(String mediaPath);
}
