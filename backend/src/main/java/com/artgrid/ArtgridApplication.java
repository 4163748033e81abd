package com.artgrid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for the ARTGRID backend.
 *
 * This Spring Boot application provides the REST API of the student art community,
 * featuring:
 * - Registration restricted to institutional email addresses, password login and JWT
 * - Artwork upload to object storage with a pending/approved/rejected moderation workflow
 * - Likes, comments with keyword flagging and public user galleries
 * - Moderator tooling: review queue, moderation log, featured artworks and statistics
 * - A single SQLite database file with foreign keys and write-ahead logging
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ArtgridApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArtgridApplication.class, args);
    }
}
