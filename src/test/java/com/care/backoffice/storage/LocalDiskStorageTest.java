package com.care.backoffice.storage;

import com.care.backoffice.config.BackofficeProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LocalDiskStorageTest {

    @TempDir
    Path dir;

    @Test
    void storedFileIsServedUnderPublicPathAndCanBeDeleted() throws Exception {
        LocalDiskStorage storage = new LocalDiskStorage(properties(dir));

        String url = storage.store(new byte[]{7, 7, 7}, "1700000000000-abc.png", "image/png");

        assertEquals("/uploads/1700000000000-abc.png", url);
        assertArrayEquals(new byte[]{7, 7, 7}, Files.readAllBytes(dir.resolve("1700000000000-abc.png")));
        assertTrue(storage.delete(url));
        assertFalse(Files.exists(dir.resolve("1700000000000-abc.png")));
    }

    @Test
    void foreignUrlsAreIgnored() {
        LocalDiskStorage storage = new LocalDiskStorage(properties(dir));

        assertFalse(storage.delete("https://cdn.example/photo.png"));
        assertFalse(storage.delete(null));
    }

    @Test
    void pathTraversalIsRefused() {
        LocalDiskStorage storage = new LocalDiskStorage(properties(dir));

        assertThrows(IllegalArgumentException.class, () -> storage.delete("/uploads/../secret.txt"));
    }

    @Test
    void generatedNamesKeepPlainExtensions() {
        assertTrue(UploadService.filename("Smile.JPEG", "image/jpeg").matches("\\d+-[0-9a-f-]{36}\\.jpeg"));
        assertTrue(UploadService.filename("no-extension", "image/webp").endsWith(".webp"));
        assertTrue(UploadService.filename("weird.p?ng", "image/png").endsWith(".png"));
    }

    private static BackofficeProperties properties(Path dir) {
        return new BackofficeProperties(
                new BackofficeProperties.Cors("*", null),
                new BackofficeProperties.Upload(DataSize.ofMegabytes(4), Set.of("image/png")),
                new BackofficeProperties.Storage("local", dir.toString(), "/uploads", null, null),
                new BackofficeProperties.BootstrapAdmin(null, null, "Administrator"));
    }
}
