package org.mides.fieldvisit.service;

import org.mides.fieldvisit.config.StorageConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Keeps photos in a local directory served under {@code storage.public-base-url}.
 */
@Service
public class LocalObjectStorageService implements IObjectStorageService {

    private static final Logger logger = LoggerFactory.getLogger(LocalObjectStorageService.class);

    private final StorageConfiguration storageConfig;

    @Autowired
    public LocalObjectStorageService(StorageConfiguration storageConfig) {
        this.storageConfig = storageConfig;
    }

    @Override
    public String upload(byte[] content, String filenameHint) {
        var key = UUID.randomUUID() + "-" + sanitize(filenameHint);
        var directory = Path.of(storageConfig.getBaseDir());

        try {
            Files.createDirectories(directory);
            Files.write(directory.resolve(key), content);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to store " + key, ex);
        }

        logger.debug("Stored {} bytes as {}", content.length, key);
        var base = storageConfig.getPublicBaseUrl();
        return (base.endsWith("/") ? base : base + "/") + key;
    }

    private String sanitize(String filenameHint) {
        if (filenameHint == null || filenameHint.isBlank()) {
            return "photo.jpg";
        }
        var name = Path.of(filenameHint).getFileName().toString();
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
