package com.artgrid.exception;

/**
 * Exception thrown when a requested resource does not exist or is not visible to the caller.
 *
 * Unapproved artworks are reported with this exception on public routes, so that their
 * existence is not disclosed. Mapped to HTTP 404 Not Found.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException artwork(Long artworkId) {
        return new ResourceNotFoundException(String.format("Artwork '%d' not found.", artworkId));
    }

    public static ResourceNotFoundException user(Long userId) {
        return new ResourceNotFoundException(String.format("User '%d' not found.", userId));
    }
}
