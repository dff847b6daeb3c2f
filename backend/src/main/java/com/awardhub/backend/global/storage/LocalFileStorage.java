package com.awardhub.backend.global.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

@Component
public class LocalFileStorage implements FileStorage {

    public static final String MEDIA_DIR = "media";
    public static final String TEMP_DIR = "temp_uploads";

    private static final Logger log = LoggerFactory.getLogger(LocalFileStorage.class);
    private static final int MAX_NAME_LENGTH = 100;

    private final Path mediaRoot;
    private final Path tempRoot;

    public LocalFileStorage(@Value("${awardhub.storage.root}") String storageRoot) {
        Path root = Path.of(storageRoot).toAbsolutePath().normalize();
        this.mediaRoot = root.resolve(MEDIA_DIR);
        this.tempRoot = root.resolve(TEMP_DIR);
    }

    @Override
    public StoredFile stageTemporary(String ownerKey, MultipartFile file) {
        String originalName = originalName(file);
        String relative = sanitizeSegment(ownerKey) + "/" + uniqueName(originalName);
        write(tempRoot, relative, file);
        log.debug("Staged upload {} ({} bytes) at {}", originalName, file.getSize(), relative);
        return new StoredFile(relative, originalName, file.getSize());
    }

    @Override
    public boolean temporaryExists(String temporaryPath) {
        return Files.isRegularFile(resolveInside(tempRoot, temporaryPath));
    }

    @Override
    public String promote(String temporaryPath, String directory) {
        Path source = resolveInside(tempRoot, temporaryPath);
        if (!Files.isRegularFile(source)) {
            throw new FileStorageException("Staged file is missing: " + temporaryPath);
        }
        String fileName = source.getFileName().toString();
        String relative = sanitizeDirectory(directory) + "/" + fileName;
        Path target = resolveInside(mediaRoot, relative);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new FileStorageException("Failed to promote staged file " + temporaryPath, ex);
        }
        return relative;
    }

    @Override
    public String store(String directory, MultipartFile file) {
        String relative = sanitizeDirectory(directory) + "/" + uniqueName(originalName(file));
        write(mediaRoot, relative, file);
        return relative;
    }

    @Override
    public void deleteTemporary(String temporaryPath) {
        deleteInside(tempRoot, temporaryPath);
    }

    @Override
    public void delete(String mediaPath) {
        deleteInside(mediaRoot, mediaPath);
    }

    private void write(Path root, String relative, MultipartFile file) {
        Path target = resolveInside(root, relative);
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new FileStorageException("Failed to store file " + relative, ex);
        }
    }

    private void deleteInside(Path root, String relative) {
        if (!StringUtils.hasText(relative)) {
            return;
        }
        try {
            Files.deleteIfExists(resolveInside(root, relative));
        } catch (IOException ex) {
            throw new FileStorageException("Failed to delete file " + relative, ex);
        }
    }

    private Path resolveInside(Path root, String relative) {
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new FileStorageException("Path escapes storage root: " + relative);
        }
        return resolved;
    }

    private String originalName(MultipartFile file) {
        String name = StringUtils.getFilename(file.getOriginalFilename());
        return StringUtils.hasText(name) ? name : "upload";
    }

    private String uniqueName(String originalName) {
        String safe = originalName.replaceAll("[^A-Za-z0-9._-]", "_");
        if (safe.length() > MAX_NAME_LENGTH) {
            String extension = StringUtils.getFilenameExtension(safe);
            safe = extension == null
                    ? safe.substring(0, MAX_NAME_LENGTH)
                    : safe.substring(0, MAX_NAME_LENGTH - extension.length() - 1) + "." + extension;
        }
        return UUID.randomUUID().toString().replace("-", "") + "_" + safe;
    }

    private String sanitizeSegment(String segment) {
        return segment.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
    }

    private String sanitizeDirectory(String directory) {
        String trimmed = directory.replaceAll("^/+|/+$", "");
        StringBuilder sb = new StringBuilder();
        for (String part : trimmed.split("/")) {
            if (part.isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(sanitizeSegment(part));
        }
        return sb.toString();
    }
}
