package com.artgrid.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Application settings bound from the {@code artgrid.*} namespace of application.yml.
 *
 * A single instance is created at startup and handed to the components that need it
 * through their constructors. Secrets (JWT key, storage credentials, admin password)
 * are expected to come from environment variables in production.
 */
@Data
@ConfigurationProperties(prefix = "artgrid")
public class ArtgridProperties {

    /**
     * Public URL of the web frontend, used to build links in notification emails.
     */
    private String publicBaseUrl = "http://localhost:5173";

    private Jwt jwt = new Jwt();

    private Registration registration = new Registration();

    private Comments comments = new Comments();

    private Catalog catalog = new Catalog();

    private Upload upload = new Upload();

    private Storage storage = new Storage();

    private Mail mail = new Mail();

    private Admin admin = new Admin();

    @Data
    public static class Jwt {

        /**
         * HMAC secret, at least 256 bits for HS256.
         */
        private String secret;

        /**
         * Token lifetime in milliseconds. Defaults to 7 days.
         */
        private long expiration = 7L * 24 * 60 * 60 * 1000;
    }

    @Data
    public static class Registration {

        /**
         * Regular expression every registration email must match.
         */
        private String emailPattern = "^[a-zA-Z0-9._%+-]+@my\\.uopeople\\.edu$";

        /**
         * Human-readable hint returned when the email pattern does not match.
         */
        private String emailHint = "Must use UoPeople email (@my.uopeople.edu)";
    }

    @Data
    public static class Comments {

        /**
         * Words that flag a comment when contained in it (case-insensitive).
         */
        private List<String> blockedWords = new ArrayList<>(List.of("spam", "inappropriate"));
    }

    @Data
    public static class Catalog {

        private List<String> categories = new ArrayList<>(List.of(
                "Digital Art", "Painting", "Drawing", "Photography", "Sculpture",
                "Printmaking", "Mixed Media", "Other"));

        private List<String> mediums = new ArrayList<>(List.of(
                "Digital Art", "Oil Paint", "Acrylic Paint", "Watercolor", "Pencil",
                "Charcoal", "Photography", "Clay", "Mixed Media", "Other"));
    }

    @Data
    public static class Upload {

        private List<String> allowedExtensions = new ArrayList<>(List.of("png", "jpg", "jpeg", "gif", "mp4"));
    }

    @Data
    public static class Storage {

        /**
         * Either {@code s3} or {@code local}.
         */
        private String provider = "s3";

        private String bucket = "artgrid-artworks";

        /**
         * Endpoint override for S3-compatible providers (MinIO, Hetzner, R2). Empty for AWS.
         */
        private String endpoint;

        private String region = "us-east-1";

        private String accessKey;

        private String secretKey;

        /**
         * Base URL under which uploaded objects are publicly readable.
         */
        private String publicUrl;

        /**
         * Target directory of the local provider.
         */
        private String localDir = "uploads";
    }

    @Data
    public static class Mail {

        private boolean enabled = true;

        private String from = "no-reply@artgrid.local";
    }

    @Data
    public static class Admin {

        private String email = "admin@my.uopeople.edu";

        private String password;

        private String fullName = "ARTGRID Admin";

        private String studentId = "ADMIN001";
    }
}
