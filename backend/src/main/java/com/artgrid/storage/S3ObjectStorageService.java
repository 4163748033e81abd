package com.artgrid.storage;

import com.artgrid.config.ArtgridProperties;
import com.artgrid.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.io.InputStream;

/**
 * Stores artwork files in an S3-compatible bucket.
 *
 * Works against AWS S3 as well as providers exposing the S3 API (MinIO, Cloudflare R2)
 * through {@code artgrid.storage.endpoint}. Objects are expected to be publicly
 * readable under {@code artgrid.storage.public-url}; when that is not set the virtual
 * hosted AWS URL is returned.
 */
@Service
@ConditionalOnProperty(prefix = "artgrid.storage", name = "provider", havingValue = "s3", matchIfMissing = true)
@Slf4j
public class S3ObjectStorageService implements ObjectStorageService {

    private final S3Client s3Client;
    private final ArtgridProperties.Storage storage;

    public S3ObjectStorageService(S3Client s3Client, ArtgridProperties properties) {
        this.s3Client = s3Client;
        this.storage = properties.getStorage();
    }

    @Override
    public String store(String key, MultipartFile file) {
        log.debug("Uploading object to S3: bucket={}, key={}, size={}", storage.getBucket(), key, file.getSize());

        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(storage.getBucket())
                .key(key)
                .contentType(file.getContentType())
                .contentLength(file.getSize())
                .build();

        try (InputStream inputStream = file.getInputStream()) {
            s3Client.putObject(putRequest, RequestBody.fromInputStream(inputStream, file.getSize()));
        } catch (IOException | SdkException e) {
            log.error("S3 upload failed: bucket={}, key={}, error={}", storage.getBucket(), key, e.getMessage());
            throw StorageException.uploadFailed(key, e);
        }

        String url = publicUrl(key);
        log.info("Stored object in S3: key={}, url={}", key, url);
        return url;
    }

    String publicUrl(String key) {
        if (StringUtils.hasText(storage.getPublicUrl())) {
            return StringUtils.trimTrailingCharacter(storage.getPublicUrl(), '/') + "/" + key;
        }
        return String.format("https://%s.s3.%s.amazonaws.com/%s", storage.getBucket(), storage.getRegion(), key);
    }
}
