package com.artgrid.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Comment left by a user on an approved artwork.
 *
 * Comments are append-only. {@code flagged} is decided once at creation time by the
 * content filter; flagged comments stay in the table but are hidden from the public
 * listing.
 *
 * Database Table: comments
 */
@Entity
@Table(name = "comments", indexes = {
    @Index(name = "idx_comment_artwork_id", columnList = "artwork_id"),
    @Index(name = "idx_comment_user_id", columnList = "user_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Comment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_comment_user"))
    @ToString.Exclude
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "artwork_id", nullable = false, foreignKey = @ForeignKey(name = "fk_comment_artwork"))
    @ToString.Exclude
    private Artwork artwork;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "is_flagged", nullable = false, updatable = false)
    private Boolean flagged = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public Comment(User user, Artwork artwork, String content, boolean flagged) {
        this.user = user;
        this.artwork = artwork;
        this.content = content;
        this.flagged = flagged;
    }
}
