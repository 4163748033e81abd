package com.artgrid.service;

import com.artgrid.config.ArtgridProperties;
import com.artgrid.dto.response.ArtworkPageResponse;
import com.artgrid.dto.response.ArtworkResponse;
import com.artgrid.dto.response.ArtworkUploadResponse;
import com.artgrid.dto.response.CategoriesResponse;
import com.artgrid.dto.response.PaginationInfo;
import com.artgrid.entity.Artwork;
import com.artgrid.entity.User;
import com.artgrid.exception.ResourceNotFoundException;
import com.artgrid.repository.ArtworkRepository;
import com.artgrid.storage.ObjectStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for artwork submission and public browsing.
 *
 * Upload flow:
 * 1. Resolve the uploader
 * 2. Validate the file (present, named, non-empty, allowed extension) and the form fields
 * 3. Write the binary to object storage under a random key
 * 4. Persist the artwork, approved right away when the uploader is verified
 * 5. Send a submission email
 *
 * The storage write happens before any row is inserted, so a storage failure leaves
 * no artwork behind.
 *
 * Public reads only ever see approved artworks; anything else is reported as not
 * found.
 */
@Service
@Slf4j
public class ArtworkService {

    static final int MAX_PAGE_SIZE = 100;

    private final ArtworkRepository artworkRepository;
    private final ObjectStorageService storageService;
    private final AccessPolicy accessPolicy;
    private final NotificationService notificationService;
    private final ArtgridProperties properties;
    private final Set<String> allowedExtensions;

    public ArtworkService(ArtworkRepository artworkRepository,
                          ObjectStorageService storageService,
                          AccessPolicy accessPolicy,
                          NotificationService notificationService,
                          ArtgridProperties properties) {
        this.artworkRepository = artworkRepository;
        this.storageService = storageService;
        this.accessPolicy = accessPolicy;
        this.notificationService = notificationService;
        this.properties = properties;
        this.allowedExtensions = properties.getUpload().getAllowedExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Submit a new artwork.
     *
     * @param authentication the uploader
     * @param file the image or video file
     * @param title required title
     * @param description optional description
     * @param medium required medium
     * @param category required category
     * @param tags optional comma separated tags
     * @param creationDate optional ISO date (yyyy-MM-dd); ignored when unparseable
     * @return the new artwork ID and its initial status
     * @throws IllegalArgumentException if the file or a required field is missing or invalid
     * @throws com.artgrid.exception.StorageException if the storage provider fails
     */
    public ArtworkUploadResponse upload(Authentication authentication,
                                        MultipartFile file,
                                        String title,
                                        String description,
                                        String medium,
                                        String category,
                                        String tags,
                                        String creationDate) {
        // Step 1: Resolve uploader
        User artist = accessPolicy.currentUser(authentication);
        log.info("Artwork upload requested by user: {}, title: {}", artist.getId(), title);

        // Step 2: Validate input
        String extension = validateFile(file);
        if (!StringUtils.hasText(title) || !StringUtils.hasText(medium) || !StringUtils.hasText(category)) {
            log.warn("Upload rejected, missing required fields: user={}", artist.getId());
            throw new IllegalArgumentException("Title, medium, and category are required");
        }

        // Step 3: Store binary
        String key = "artworks/" + UUID.randomUUID() + "." + extension;
        String fileUrl = storageService.store(key, file);

        // Step 4: Persist
        Artwork artwork = new Artwork(
                artist,
                title.trim(),
                description != null ? description : "",
                medium.trim(),
                category.trim(),
                fileUrl,
                tags != null ? tags : "",
                parseCreationDate(creationDate)
        );
        if (artist.isVerified()) {
            artwork.approve();
        }
        artwork = artworkRepository.save(artwork);
        log.info("Artwork stored: id={}, artist={}, status={}", artwork.getId(), artist.getId(), artwork.getStatus());

        // Step 5: Notify
        notificationService.sendSubmissionReceived(artist, artwork);

        return new ArtworkUploadResponse(
                "Artwork uploaded successfully",
                artwork.getId(),
                artwork.getStatus().getValue()
        );
    }

    /**
     * List approved artworks, newest submission first.
     *
     * @param page 1-based page number
     * @param perPage page size (1-100)
     * @param category optional category filter
     * @param medium optional medium filter
     * @param featuredOnly when true only featured artworks are listed
     * @return one page of artworks with pagination metadata
     */
    @Transactional(readOnly = true)
    public ArtworkPageResponse listArtworks(int page, int perPage, String category, String medium, boolean featuredOnly) {
        Pageable pageable = pageRequest(page, perPage,
                Sort.by(Sort.Order.desc("submissionDate"), Sort.Order.desc("id")));

        Page<Artwork> artworks = artworkRepository.findPublished(
                Artwork.Status.APPROVED,
                StringUtils.hasText(category) ? category : null,
                StringUtils.hasText(medium) ? medium : null,
                featuredOnly,
                pageable
        );

        log.debug("Listing artworks: page={}, perPage={}, category={}, medium={}, featured={}, total={}",
                page, perPage, category, medium, featuredOnly, artworks.getTotalElements());

        List<ArtworkResponse> items = artworks.getContent().stream()
                .map(ArtworkResponse::from)
                .toList();
        return new ArtworkPageResponse(items, PaginationInfo.from(artworks));
    }

    /**
     * Fetch one approved artwork and count the view.
     *
     * The counter is incremented with a single UPDATE statement, so concurrent
     * viewers never overwrite each other's increments. Every call counts.
     *
     * @param artworkId the artwork ID
     * @return the artwork including the incremented view count
     * @throws ResourceNotFoundException if the artwork does not exist or is not approved
     */
    @Transactional
    public ArtworkResponse getArtwork(Long artworkId) {
        requireApproved(artworkId);

        artworkRepository.incrementViews(artworkId);

        Artwork artwork = artworkRepository.findWithArtistById(artworkId)
                .orElseThrow(() -> ResourceNotFoundException.artwork(artworkId));
        return ArtworkResponse.from(artwork);
    }

    public CategoriesResponse categories() {
        return new CategoriesResponse(
                List.copyOf(properties.getCatalog().getCategories()),
                List.copyOf(properties.getCatalog().getMediums())
        );
    }

    /**
     * Load an artwork that is visible to the public.
     *
     * @throws ResourceNotFoundException if missing or not approved
     */
    Artwork requireApproved(Long artworkId) {
        Artwork artwork = artworkRepository.findById(artworkId)
                .orElseThrow(() -> ResourceNotFoundException.artwork(artworkId));
        if (!artwork.isApproved()) {
            log.debug("Hidden artwork requested: id={}, status={}", artworkId, artwork.getStatus());
            throw ResourceNotFoundException.artwork(artworkId);
        }
        return artwork;
    }

    static Pageable pageRequest(int page, int perPage, Sort sort) {
        if (page < 1) {
            throw new IllegalArgumentException("Page number must be >= 1");
        }
        if (perPage < 1 || perPage > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("per_page must be between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(page - 1, perPage, sort);
    }

    private String validateFile(MultipartFile file) {
        if (file == null) {
            throw new IllegalArgumentException("No file uploaded");
        }
        String filename = file.getOriginalFilename();
        if (!StringUtils.hasText(filename)) {
            throw new IllegalArgumentException("No file selected");
        }
        String extension = StringUtils.getFilenameExtension(filename);
        if (extension == null || !allowedExtensions.contains(extension.toLowerCase(Locale.ROOT))) {
            log.warn("Upload rejected, file type not allowed: {}", filename);
            throw new IllegalArgumentException("File type not allowed");
        }
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        return extension.toLowerCase(Locale.ROOT);
    }

    private LocalDate parseCreationDate(String creationDate) {
        if (!StringUtils.hasText(creationDate)) {
            return null;
        }
        try {
            return LocalDate.parse(creationDate.trim());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable creation date: {}", creationDate);
            return null;
        }
    }
}
