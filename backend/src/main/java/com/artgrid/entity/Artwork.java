package com.artgrid.entity;

import com.artgrid.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Artwork entity for submitted pieces.
 *
 * An artwork belongs to exactly one user and moves through a small moderation
 * lifecycle: it is submitted as PENDING (or APPROVED directly when the artist is
 * verified) and a moderator either approves or rejects it. Neither outcome can be
 * changed afterwards; the only mutable flag on an approved artwork is
 * {@code featured}.
 *
 * {@code likesCount} and {@code viewsCount} are denormalized counters. They are only
 * written through single-statement updates in {@link com.artgrid.repository.ArtworkRepository},
 * never through this entity.
 *
 * Database Table: artworks
 */
@Entity
@Table(name = "artworks", indexes = {
    @Index(name = "idx_artwork_user_id", columnList = "user_id"),
    @Index(name = "idx_artwork_status", columnList = "status"),
    @Index(name = "idx_artwork_submission_date", columnList = "submission_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Artwork {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_artwork_user"))
    @ToString.Exclude
    private User artist;

    @Column(name = "title", nullable = false, length = 100)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "medium", nullable = false, length = 50)
    private String medium;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    /**
     * Public URL returned by the object storage provider.
     */
    @Column(name = "file_url", nullable = false, length = 255)
    private String fileUrl;

    @Column(name = "thumbnail_url", length = 255)
    private String thumbnailUrl;

    /**
     * Free-form, comma separated.
     */
    @Column(name = "tags", length = 255)
    private String tags;

    @Column(name = "creation_date")
    private LocalDate creationDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status = Status.PENDING;

    @CreationTimestamp
    @Column(name = "submission_date", nullable = false, updatable = false)
    private LocalDateTime submissionDate;

    @Column(name = "approval_date")
    private LocalDateTime approvalDate;

    @Column(name = "rejection_feedback", columnDefinition = "TEXT")
    private String rejectionFeedback;

    @Column(name = "likes_count", nullable = false, insertable = true, updatable = false)
    private Integer likesCount = 0;

    @Column(name = "views_count", nullable = false, insertable = true, updatable = false)
    private Integer viewsCount = 0;

    @Column(name = "is_featured", nullable = false)
    private Boolean featured = false;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public Artwork(User artist, String title, String description, String medium, String category,
                   String fileUrl, String tags, LocalDate creationDate) {
        this.artist = artist;
        this.title = title;
        this.description = description;
        this.medium = medium;
        this.category = category;
        this.fileUrl = fileUrl;
        this.thumbnailUrl = fileUrl;
        this.tags = tags;
        this.creationDate = creationDate;
        this.status = Status.PENDING;
        this.likesCount = 0;
        this.viewsCount = 0;
        this.featured = false;
    }

    public boolean isPending() {
        return status == Status.PENDING;
    }

    public boolean isApproved() {
        return status == Status.APPROVED;
    }

    /**
     * Moves a pending artwork to APPROVED and stamps the approval date.
     *
     * @throws InvalidStateException if the artwork is not pending
     */
    public void approve() {
        if (!isPending()) {
            throw InvalidStateException.notPending(id, status);
        }
        this.status = Status.APPROVED;
        this.approvalDate = LocalDateTime.now();
    }

    /**
     * Moves a pending artwork to REJECTED, keeping the moderator's feedback.
     *
     * @throws InvalidStateException if the artwork is not pending
     */
    public void reject(String feedback) {
        if (!isPending()) {
            throw InvalidStateException.notPending(id, status);
        }
        this.status = Status.REJECTED;
        this.rejectionFeedback = feedback;
    }

    /**
     * Flips the featured flag of an approved artwork.
     *
     * @return the new value of the flag
     * @throws InvalidStateException if the artwork is not approved
     */
    public boolean toggleFeatured() {
        if (!isApproved()) {
            throw InvalidStateException.notApproved(id, status);
        }
        this.featured = !Boolean.TRUE.equals(featured);
        return featured;
    }

    public enum Status {
        PENDING,
        APPROVED,
        REJECTED;

        public String getValue() {
            return name().toLowerCase();
        }
    }
}
