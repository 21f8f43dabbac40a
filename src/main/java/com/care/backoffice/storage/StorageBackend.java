package com.care.backoffice.storage;

/**
 * Where uploaded files end up. Implementations return the public URL of a
 * stored file; {@link #delete} takes that same URL.
 */
public interface StorageBackend {

    String store(byte[] content, String filename, String contentType);

    /**
     * Removes a previously stored file. URLs this backend did not produce are
     * ignored.
     *
     * @return whether a file was removed
     */
    boolean delete(String url);
}
