package com.artgrid.config;

import com.artgrid.storage.LocalObjectStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Object storage wiring.
 *
 * With {@code artgrid.storage.provider=s3} (the default) an {@link S3Client} is built
 * from the storage settings. Static credentials are used when both keys are present,
 * otherwise the default AWS provider chain applies. With {@code provider=local} the
 * upload directory is exposed read-only under {@code /uploads/**}.
 */
@Configuration
@Slf4j
public class StorageConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "artgrid.storage", name = "provider", havingValue = "s3", matchIfMissing = true)
    public S3Client s3Client(ArtgridProperties properties) {
        ArtgridProperties.Storage storage = properties.getStorage();

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(storage.getRegion()))
                .credentialsProvider(credentialsProvider(storage));

        if (StringUtils.hasText(storage.getEndpoint())) {
            // S3-compatible providers generally need path-style addressing
            builder.endpointOverride(URI.create(storage.getEndpoint()))
                    .forcePathStyle(true);
        }

        log.info("S3 storage configured: bucket={}, region={}, endpoint={}",
                storage.getBucket(), storage.getRegion(),
                StringUtils.hasText(storage.getEndpoint()) ? storage.getEndpoint() : "aws");
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "artgrid.storage", name = "provider", havingValue = "local")
    public WebMvcConfigurer localUploadsResourceHandler(LocalObjectStorageService storageService) {
        String location = storageService.getRootDir().toUri().toString();
        log.info("Serving local uploads from {}", location);
        return new WebMvcConfigurer() {
            @Override
            public void addResourceHandlers(ResourceHandlerRegistry registry) {
                registry.addResourceHandler(LocalObjectStorageService.URL_PREFIX + "**")
                        .addResourceLocations(location.endsWith("/") ? location : location + "/");
            }
        };
    }

    private AwsCredentialsProvider credentialsProvider(ArtgridProperties.Storage storage) {
        if (StringUtils.hasText(storage.getAccessKey()) && StringUtils.hasText(storage.getSecretKey())) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
