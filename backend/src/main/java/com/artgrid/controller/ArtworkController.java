package com.artgrid.controller;

import com.artgrid.dto.response.ArtworkPageResponse;
import com.artgrid.dto.response.ArtworkResponse;
import com.artgrid.dto.response.ArtworkUploadResponse;
import com.artgrid.dto.response.CategoriesResponse;
import com.artgrid.dto.response.LikeToggleResponse;
import com.artgrid.exception.StorageException;
import com.artgrid.service.ArtworkService;
import com.artgrid.service.LikeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST Controller for artwork submission, browsing and likes.
 *
 * Browsing is public and only ever shows approved artworks. Uploading and liking
 * require a bearer token.
 *
 * @see com.artgrid.service.ArtworkService
 * @see com.artgrid.service.LikeService
 */
@RestController
@RequestMapping("/api/artworks")
@RequiredArgsConstructor
@Slf4j
public class ArtworkController {

    private final ArtworkService artworkService;
    private final LikeService likeService;

    /**
     * Upload a new artwork.
     *
     * Endpoint: POST /api/artworks/upload (multipart/form-data)
     * Authentication: Required (JWT token)
     *
     * Form fields: file, title, description, medium, category, tags, creation_date (yyyy-MM-dd).
     * The file part is optional at the binding level so that a missing file yields
     * the same 400 message as an empty one.
     *
     * Example response (201):
     * <pre>
     * {
     *   "message": "Artwork uploaded successfully",
     *   "artwork_id": 12,
     *   "status": "pending"
     * }
     * </pre>
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ArtworkUploadResponse> upload(
            @RequestPart(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "description", required = false) String description,
            @RequestParam(value = "medium", required = false) String medium,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "tags", required = false) String tags,
            @RequestParam(value = "creation_date", required = false) String creationDate,
            Authentication authentication) {

        log.info("Artwork upload request received from user: {}, fileName: {}",
                authentication.getName(), file != null ? file.getOriginalFilename() : null);

        try {
            ArtworkUploadResponse response = artworkService.upload(
                    authentication, file, title, description, medium, category, tags, creationDate);
            return ResponseEntity.status(HttpStatus.CREATED).body(response);

        } catch (IllegalArgumentException e) {
            log.warn("Artwork upload validation failed: {}", e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this

        } catch (StorageException e) {
            log.error("Artwork upload could not be stored for user: {}", authentication.getName());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    /**
     * List approved artworks.
     *
     * Endpoint: GET /api/artworks?page=1&amp;per_page=12&amp;category=Painting&amp;medium=Oil%20Paint&amp;featured=true
     * Authentication: Not required
     */
    @GetMapping
    public ResponseEntity<ArtworkPageResponse> listArtworks(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "12") int perPage,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String medium,
            @RequestParam(defaultValue = "false") boolean featured) {
        return ResponseEntity.ok(artworkService.listArtworks(page, perPage, category, medium, featured));
    }

    @GetMapping("/categories")
    public ResponseEntity<CategoriesResponse> categories() {
        return ResponseEntity.ok(artworkService.categories());
    }

    /**
     * Fetch one approved artwork. Every call adds one view.
     *
     * Endpoint: GET /api/artworks/{id}
     * Authentication: Not required
     */
    @GetMapping("/{id}")
    public ResponseEntity<ArtworkResponse> getArtwork(@PathVariable Long id) {
        return ResponseEntity.ok(artworkService.getArtwork(id));
    }

    /**
     * Toggle the caller's like on an approved artwork.
     *
     * Endpoint: POST /api/artworks/{id}/like
     * Authentication: Required (JWT token)
     *
     * Example response:
     * <pre>
     * { "liked": true, "likes_count": 4 }
     * </pre>
     */
    @PostMapping("/{id}/like")
    public ResponseEntity<LikeToggleResponse> toggleLike(@PathVariable Long id, Authentication authentication) {
        log.debug("Like toggle requested: artwork={}, user={}", id, authentication.getName());
        return ResponseEntity.ok(likeService.toggleLike(authentication, id));
    }
}
