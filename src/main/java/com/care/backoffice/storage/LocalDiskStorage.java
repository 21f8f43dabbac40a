package com.care.backoffice.storage;

import com.care.backoffice.config.BackofficeProperties;
import com.care.backoffice.exception.UpstreamStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes uploads to a local directory that {@code WebConfig} serves under the
 * configured public path.
 */
@Component
@ConditionalOnProperty(prefix = "backoffice.storage", name = "backend", havingValue = "local", matchIfMissing = true)
public class LocalDiskStorage implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalDiskStorage.class);

    private final Path directory;
    private final String publicPath;

    public LocalDiskStorage(BackofficeProperties properties) {
        this.directory = Path.of(properties.storage().localDirectory()).toAbsolutePath().normalize();
        String path = properties.storage().publicPath();
        this.publicPath = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    @Override
    public String store(byte[] content, String filename, String contentType) {
        try {
            Files.createDirectories(directory);
            Files.write(resolve(filename), content);
        } catch (IOException e) {
            throw new UpstreamStorageException("Could not store the file.", e);
        }
        log.info("Stored {} ({} bytes) in {}", filename, content.length, directory);
        return publicPath + "/" + filename;
    }

    @Override
    public boolean delete(String url) {
        String prefix = publicPath + "/";
        if (url == null || !url.startsWith(prefix)) {
            return false;
        }
        try {
            boolean removed = Files.deleteIfExists(resolve(url.substring(prefix.length())));
            log.info("Deleted stored file {} (existed={})", url, removed);
            return removed;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete " + url, e);
        }
    }

    private Path resolve(String filename) {
        Path target = directory.resolve(filename).normalize();
        if (!target.getParent().equals(directory)) {
            throw new IllegalArgumentException("Invalid file name: " + filename);
        }
        return target;
    }
}
