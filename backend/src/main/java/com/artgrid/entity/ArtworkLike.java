package com.artgrid.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A user's like on an artwork.
 *
 * The unique constraint on (user_id, artwork_id) guarantees at most one like per user
 * and artwork, including under concurrent toggles.
 *
 * Database Table: likes
 */
@Entity
@Table(name = "likes",
    uniqueConstraints = @UniqueConstraint(name = "uk_like_user_artwork", columnNames = {"user_id", "artwork_id"}),
    indexes = @Index(name = "idx_like_artwork_id", columnList = "artwork_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArtworkLike {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_like_user"))
    @ToString.Exclude
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "artwork_id", nullable = false, foreignKey = @ForeignKey(name = "fk_like_artwork"))
    @ToString.Exclude
    private Artwork artwork;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ArtworkLike(User user, Artwork artwork) {
        this.user = user;
        this.artwork = artwork;
    }
}
