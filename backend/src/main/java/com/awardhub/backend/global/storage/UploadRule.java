package com.awardhub.backend.global.storage;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/**
 * Size and extension limits for one kind of upload.
 */
public record UploadRule(long maxBytes, Set<String> allowedExtensions) {

    public static final long FIVE_MEGABYTES = 5L * 1024 * 1024;

    public static final UploadRule IMAGE = new UploadRule(FIVE_MEGABYTES, Set.of("jpg", "jpeg", "png", "webp"));
    public static final UploadRule DOCUMENT = new UploadRule(FIVE_MEGABYTES, Set.of("pdf", "doc", "docx", "jpg", "jpeg", "png"));

    /**
     * @return a human-readable violation, or empty when the file is acceptable
     */
    public Optional<String> check(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return Optional.of("File is empty");
        }
        if (file.getSize() > maxBytes) {
            return Optional.of("File size must not exceed " + (maxBytes / (1024 * 1024)) + "MB");
        }
        String extension = StringUtils.getFilenameExtension(file.getOriginalFilename());
        if (extension == null || !allowedExtensions.contains(extension.toLowerCase(Locale.ROOT))) {
            return Optional.of("Unsupported file type. Allowed: " + String.join(", ", allowedExtensions.stream().sorted().toList()));
        }
        return Optional.empty();
    }
}
