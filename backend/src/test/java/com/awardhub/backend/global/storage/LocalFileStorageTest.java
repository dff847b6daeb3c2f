package com.awardhub.backend.global.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

class LocalFileStorageTest {

    @TempDir
    Path root;

    private LocalFileStorage storage;

    @BeforeEach
    void setUp() {
        storage = new LocalFileStorage(root.toString());
    }

    @Test
    void stagedFileCanBePromotedIntoMedia() throws Exception {
        MockMultipartFile upload = new MockMultipartFile("certificates", "My Diploma.pdf", "application/pdf",
                "pdf-bytes".getBytes(StandardCharsets.UTF_8));

        StoredFile staged = storage.stageTemporary("User_42", upload);

        assertThat(staged.originalName()).isEqualTo("My Diploma.pdf");
        assertThat(staged.size()).isEqualTo(9);
        assertThat(staged.path()).startsWith("user_42/").endsWith("_My_Diploma.pdf");
        assertThat(storage.temporaryExists(staged.path())).isTrue();

        String promoted = storage.promote(staged.path(), "/applications/certificates/");

        assertThat(promoted).startsWith("applications/certificates/");
        Path media = root.resolve(LocalFileStorage.MEDIA_DIR).resolve(promoted);
        assertThat(Files.readString(media)).isEqualTo("pdf-bytes");
        // promotion copies; the staged copy is removed separately
        assertThat(storage.temporaryExists(staged.path())).isTrue();

        storage.deleteTemporary(staged.path());
        assertThat(storage.temporaryExists(staged.path())).isFalse();
    }

    @Test
    void promotingMissingFileFails() {
        assertThatThrownBy(() -> storage.promote("nobody/gone.pdf", "applications/files"))
                .isInstanceOf(FileStorageException.class);
    }

    @Test
    void pathsOutsideStorageRootAreRejected() {
        assertThatThrownBy(() -> storage.temporaryExists("../media/secret.txt"))
                .isInstanceOf(FileStorageException.class);
        assertThatThrownBy(() -> storage.delete("../../etc/passwd"))
                .isInstanceOf(FileStorageException.class);
    }

    @Test
    void deletingBlankOrMissingPathIsNoop() {
        storage.delete(null);
        storage.delete("rewards/missing.png");
        storage.deleteTemporary("");
    }

    @Test
    void storedFilesGetUniqueNames() {
        MockMultipartFile image = new MockMultipartFile("image", "medal.png", "image/png", new byte[]{1, 2, 3});

        String first = storage.store("rewards", image);
        String second = storage.store("rewards", image);

        assertThat(first).isNotEqualTo(second);
        assertThat(root.resolve(LocalFileStorage.MEDIA_DIR).resolve(first)).exists();
    }
}
