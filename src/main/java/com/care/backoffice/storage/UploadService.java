package com.care.backoffice.storage;

import com.care.backoffice.config.BackofficeProperties;
import com.care.backoffice.exception.PayloadTooLargeException;
import com.care.backoffice.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Checks an uploaded image and hands it to the configured {@link StorageBackend}.
 * Size and type are checked before anything is written.
 */
@Service
public class UploadService {

    private static final Logger log = LoggerFactory.getLogger(UploadService.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", "jpg",
            "image/png", "png",
            "image/webp", "webp",
            "image/gif", "gif",
            "image/svg+xml", "svg");

    private final StorageBackend storage;
    private final BackofficeProperties.Upload limits;

    public UploadService(StorageBackend storage, BackofficeProperties properties) {
        this.storage = storage;
        this.limits = properties.upload();
    }

    public String upload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw ValidationException.of("file", "A file is required.");
        }
        long max = limits.maxFileSize().toBytes();
        if (file.getSize() > max) {
            log.warn("Rejected upload {} of {} bytes (limit {})", file.getOriginalFilename(), file.getSize(), max);
            throw new PayloadTooLargeException("File must be smaller than " + limits.maxFileSize().toMegabytes() + "MB.");
        }
        String contentType = StringUtils.lowerCase(file.getContentType(), Locale.ROOT);
        if (contentType == null || !limits.allowedTypes().contains(contentType)) {
            log.warn("Rejected upload {} with type {}", file.getOriginalFilename(), contentType);
            throw ValidationException.of("file", "Only JPEG, PNG, WEBP, GIF or SVG images are allowed.");
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read uploaded file", e);
        }
        return storage.store(bytes, filename(file.getOriginalFilename(), contentType), contentType);
    }

    /** {@code <epoch millis>-<uuid>.<ext>}; the original extension is kept when it is plain. */
    static String filename(String original, String contentType) {
        String ext = StringUtils.lowerCase(StringUtils.substringAfterLast(StringUtils.defaultString(original), "."), Locale.ROOT);
        if (ext == null || !ext.matches("[a-z0-9]{1,5}")) {
            ext = EXTENSIONS.getOrDefault(contentType, "bin");
        }
        return System.currentTimeMillis() + "-" + UUID.randomUUID() + "." + ext;
    }
}
