package com.decoadmin.backend.modules.storage.infrastructure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.decoadmin.backend.global.config.StorageProperties;
import com.decoadmin.backend.modules.storage.application.BlobStorage;
import com.decoadmin.backend.modules.storage.application.BlobStorageException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stores blobs below {@code storage.local.root}; {@link StorageWebConfig} serves them
 * back under {@code storage.public-base-url}.
 */
@Component
public class LocalFileBlobStorage implements BlobStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalFileBlobStorage.class);

    private final Path root;
    private final String publicBaseUrl;

    public LocalFileBlobStorage(StorageProperties properties) {
        this.root = Path.of(properties.local().root()).toAbsolutePath().normalize();
        this.publicBaseUrl = stripTrailingSlash(properties.publicBaseUrl());
    }

    @Override
    public String write(String path, String contentType, byte[] content) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            // write next to the target first so readers never see a partial file
            Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            try {
                Files.write(temp, content);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new BlobStorageException("Could not store " + path, ex);
        }
        log.debug("Stored blob path={} contentType={} bytes={}", path, contentType, content.length);
        return publicBaseUrl + "/" + root.relativize(target).toString().replace('\\', '/');
    }

    Path root() {
        return root;
    }

    private Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Blob path must not be blank");
        }
        Path relative = Path.of(path);
        if (relative.isAbsolute()) {
            throw new IllegalArgumentException("Blob path must be relative: " + path);
        }
        Path target = root.resolve(relative).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Blob path escapes storage root: " + path);
        }
        return target;
    }

    private static String stripTrailingSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
