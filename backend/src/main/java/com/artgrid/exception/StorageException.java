package com.artgrid.exception;

/**
 * Exception thrown when an uploaded file cannot be written to object storage.
 *
 * GlobalExceptionHandler maps this to HTTP 500 Internal Server Error with RFC 7807 format.
 *
 * @see com.artgrid.storage.ObjectStorageService
 */
public class StorageException extends RuntimeException {

    private final String errorCode;

    public StorageException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Constructs a StorageException for a failed upload.
     *
     * @param key the object key that was being written
     * @param cause the provider error
     * @return a StorageException with a formatted message
     */
    public static StorageException uploadFailed(String key, Throwable cause) {
        return new StorageException(
                "UPLOAD_FAILED",
                String.format("Failed to store file '%s'. The storage provider may be unavailable.", key),
                cause
        );
    }
}
