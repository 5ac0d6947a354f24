package com.decoadmin.backend.modules.storage.application;

/**
 * Write-only blob store for user uploaded assets.
 */
public interface BlobStorage {

    /**
     * Stores {@code content} under {@code path}, replacing anything already there.
     *
     * @param path relative, slash separated key such as {@code uploads/org-logo-<uuid>.png}
     * @return publicly reachable URL of the stored blob
     * @throws IllegalArgumentException when the path is absolute or escapes the store
     * @throws BlobStorageException     when the write fails
     */
    String write(String path, String contentType, byte[] content);
}
