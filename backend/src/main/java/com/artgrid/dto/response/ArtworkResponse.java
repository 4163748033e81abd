package com.artgrid.dto.response;

import com.artgrid.entity.Artwork;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Artwork representation shared by the browse, detail, gallery and moderation views.
 *
 * Example JSON response (detail):
 * <pre>
 * {
 *   "id": 12,
 *   "title": "Harbour at Dusk",
 *   "medium": "Oil Paint",
 *   "category": "Painting",
 *   "file_url": "https://cdn.artgrid.app/artworks/9f1c.png",
 *   "thumbnail_url": "https://cdn.artgrid.app/artworks/9f1c.png",
 *   "submission_date": "2024-02-26T10:30:00",
 *   "approval_date": "2024-02-27T08:00:00",
 *   "likes_count": 3,
 *   "views_count": 41,
 *   "is_featured": false,
 *   "status": "approved",
 *   "artist": { "id": 7, "full_name": "Ada Lovelace", "year_of_study": "Year 2" }
 * }
 * </pre>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArtworkResponse {

    private Long id;
    private String title;
    private String description;
    private String medium;
    private String category;
    private String fileUrl;
    private String thumbnailUrl;
    private String tags;
    private LocalDate creationDate;
    private LocalDateTime submissionDate;
    private LocalDateTime approvalDate;
    private Integer likesCount;
    private Integer viewsCount;
    private Boolean isFeatured;
    private String status;
    private String rejectionFeedback;
    private ArtistSummary artist;

    /**
     * Full public view, including the artist.
     */
    public static ArtworkResponse from(Artwork artwork) {
        return withoutArtist(artwork).toBuilder()
                .artist(ArtistSummary.publicView(artwork.getArtist()))
                .build();
    }

    /**
     * Gallery view: the artist is already known from the enclosing response.
     */
    public static ArtworkResponse withoutArtist(Artwork artwork) {
        return ArtworkResponse.builder()
                .id(artwork.getId())
                .title(artwork.getTitle())
                .description(artwork.getDescription())
                .medium(artwork.getMedium())
                .category(artwork.getCategory())
                .fileUrl(artwork.getFileUrl())
                .thumbnailUrl(artwork.getThumbnailUrl())
                .tags(artwork.getTags())
                .creationDate(artwork.getCreationDate())
                .submissionDate(artwork.getSubmissionDate())
                .approvalDate(artwork.getApprovalDate())
                .likesCount(artwork.getLikesCount())
                .viewsCount(artwork.getViewsCount())
                .isFeatured(artwork.getFeatured())
                .status(artwork.getStatus().getValue())
                .rejectionFeedback(artwork.getRejectionFeedback())
                .build();
    }

    /**
     * Moderation queue view, with the artist's email and verification status.
     */
    public static ArtworkResponse forModeration(Artwork artwork) {
        return withoutArtist(artwork).toBuilder()
                .artist(ArtistSummary.moderationView(artwork.getArtist()))
                .build();
    }
}
