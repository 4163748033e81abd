package com.artgrid.storage;

import com.artgrid.config.ArtgridProperties;
import com.artgrid.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores artwork files on the local filesystem, for development and tests.
 *
 * Files are served back under {@code /uploads/**} by the resource handler registered
 * in {@link com.artgrid.config.StorageConfig}.
 */
@Service
@ConditionalOnProperty(prefix = "artgrid.storage", name = "provider", havingValue = "local")
@Slf4j
public class LocalObjectStorageService implements ObjectStorageService {

    public static final String URL_PREFIX = "/uploads/";

    private final Path rootDir;

    public LocalObjectStorageService(ArtgridProperties properties) {
        this.rootDir = Path.of(properties.getStorage().getLocalDir()).toAbsolutePath().normalize();
    }

    @Override
    public String store(String key, MultipartFile file) {
        Path target = rootDir.resolve(key).normalize();
        if (!target.startsWith(rootDir)) {
            throw new IllegalArgumentException("Invalid storage key: " + key);
        }

        try (InputStream inputStream = file.getInputStream()) {
            Files.createDirectories(target.getParent());
            Files.copy(inputStream, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Local upload failed: target={}, error={}", target, e.getMessage());
            throw StorageException.uploadFailed(key, e);
        }

        log.info("Stored file locally: {}", target);
        return URL_PREFIX + key;
    }

    public Path getRootDir() {
        return rootDir;
    }
}
