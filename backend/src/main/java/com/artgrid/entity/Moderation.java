package com.artgrid.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Audit record of a moderation decision.
 *
 * Rows are only ever inserted, as a side effect of an approve or reject transition.
 * The moderator reference becomes null if the moderator's account is deleted so the
 * decision itself is kept.
 *
 * Database Table: moderations
 */
@Entity
@Table(name = "moderations", indexes = {
    @Index(name = "idx_moderation_artwork_id", columnList = "artwork_id"),
    @Index(name = "idx_moderation_moderator_id", columnList = "moderator_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Moderation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "artwork_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_moderation_artwork"))
    @ToString.Exclude
    private Artwork artwork;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "moderator_id", foreignKey = @ForeignKey(name = "fk_moderation_moderator"))
    @ToString.Exclude
    private User moderator;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 20)
    private Action action;

    @Column(name = "feedback", columnDefinition = "TEXT", updatable = false)
    private String feedback;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public Moderation(Artwork artwork, User moderator, Action action, String feedback) {
        this.artwork = artwork;
        this.moderator = moderator;
        this.action = action;
        this.feedback = feedback;
    }

    public enum Action {
        APPROVED,
        REJECTED;

        public String getValue() {
            return name().toLowerCase();
        }
    }
}
