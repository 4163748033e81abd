package com.artgrid.exception;

import com.artgrid.entity.Artwork;

/**
 * Exception thrown when an artwork transition is requested from the wrong status.
 *
 * Mapped to HTTP 400 Bad Request.
 */
public class InvalidStateException extends RuntimeException {

    private final String currentStatus;

    public InvalidStateException(String message, String currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }

    public static InvalidStateException notPending(Long artworkId, Artwork.Status status) {
        return new InvalidStateException(
                String.format("Artwork '%d' is not pending moderation (current status: %s).",
                        artworkId, status.getValue()),
                status.getValue()
        );
    }

    public static InvalidStateException notApproved(Long artworkId, Artwork.Status status) {
        return new InvalidStateException(
                String.format("Only approved artworks can be featured. Artwork '%d' is %s.",
                        artworkId, status.getValue()),
                status.getValue()
        );
    }
}
