package com.artgrid.storage;

import org.springframework.web.multipart.MultipartFile;

/**
 * Destination of uploaded artwork files.
 *
 * Implementations write the binary under the given key and return the public URL
 * that is persisted as the artwork's file URL.
 */
public interface ObjectStorageService {

    /**
     * Store a file.
     *
     * @param key object key, e.g. {@code artworks/2f1c...9a.png}
     * @param file the uploaded file
     * @return publicly reachable URL of the stored object
     * @throws com.artgrid.exception.StorageException if the provider rejects the write
     */
    String store(String key, MultipartFile file);
}
