package com.artgrid.service;

import com.artgrid.dto.response.ArtworkPageResponse;
import com.artgrid.dto.response.ArtworkResponse;
import com.artgrid.dto.response.FeatureToggleResponse;
import com.artgrid.dto.response.MessageResponse;
import com.artgrid.dto.response.ModerationResponse;
import com.artgrid.dto.response.PaginationInfo;
import com.artgrid.entity.Artwork;
import com.artgrid.entity.Moderation;
import com.artgrid.entity.User;
import com.artgrid.exception.ResourceNotFoundException;
import com.artgrid.repository.ArtworkRepository;
import com.artgrid.repository.ModerationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for the moderation workflow.
 *
 * Artworks move from PENDING to either APPROVED or REJECTED exactly once. Each
 * decision appends one entry to the moderation log in the same transaction as the
 * status change, and the artist is emailed after commit.
 *
 * Two moderators deciding on the same artwork at the same time are serialized by the
 * artwork's version column: the second commit fails with an optimistic locking error
 * (409) and leaves no log entry behind.
 *
 * All operations require a moderator or administrator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModerationService {

    private final ArtworkRepository artworkRepository;
    private final ModerationRepository moderationRepository;
    private final AccessPolicy accessPolicy;
    private final NotificationService notificationService;

    /**
     * Pending artworks, oldest submission first.
     */
    @Transactional(readOnly = true)
    public ArtworkPageResponse queue(Authentication authentication, int page, int perPage) {
        accessPolicy.requireModerator(authentication, "view the moderation queue");

        Page<Artwork> pending = artworkRepository.findByStatusOrderBySubmissionDateAscIdAsc(
                Artwork.Status.PENDING,
                ArtworkService.pageRequest(page, perPage, Sort.unsorted()));

        List<ArtworkResponse> items = pending.getContent().stream()
                .map(ArtworkResponse::forModeration)
                .toList();
        return new ArtworkPageResponse(items, PaginationInfo.from(pending));
    }

    /**
     * Approve a pending artwork.
     *
     * @param authentication the moderator
     * @param artworkId the artwork ID
     * @return confirmation message
     * @throws com.artgrid.exception.InvalidStateException if the artwork is not pending
     * @throws ResourceNotFoundException if the artwork does not exist
     */
    @Transactional
    public MessageResponse approve(Authentication authentication, Long artworkId) {
        User moderator = accessPolicy.requireModerator(authentication, "approve artworks");
        Artwork artwork = loadArtwork(artworkId);

        artwork.approve();
        artworkRepository.saveAndFlush(artwork);
        moderationRepository.save(new Moderation(artwork, moderator, Moderation.Action.APPROVED, null));

        log.info("Artwork approved: id={}, moderator={}", artworkId, moderator.getId());
        notificationService.sendApproved(artwork);
        return new MessageResponse("Artwork approved successfully");
    }

    /**
     * Reject a pending artwork with optional feedback for the artist.
     *
     * @param authentication the moderator
     * @param artworkId the artwork ID
     * @param feedback optional feedback, stored on the artwork and in the log
     * @return confirmation message
     * @throws com.artgrid.exception.InvalidStateException if the artwork is not pending
     * @throws ResourceNotFoundException if the artwork does not exist
     */
    @Transactional
    public MessageResponse reject(Authentication authentication, Long artworkId, String feedback) {
        User moderator = accessPolicy.requireModerator(authentication, "reject artworks");
        Artwork artwork = loadArtwork(artworkId);
        String normalizedFeedback = feedback != null ? feedback.trim() : "";

        artwork.reject(normalizedFeedback);
        artworkRepository.saveAndFlush(artwork);
        moderationRepository.save(new Moderation(artwork, moderator, Moderation.Action.REJECTED, normalizedFeedback));

        log.info("Artwork rejected: id={}, moderator={}", artworkId, moderator.getId());
        notificationService.sendRejected(artwork, normalizedFeedback);
        return new MessageResponse("Artwork rejected successfully");
    }

    /**
     * Flip the featured flag of an approved artwork.
     *
     * @throws com.artgrid.exception.InvalidStateException if the artwork is not approved
     */
    @Transactional
    public FeatureToggleResponse toggleFeatured(Authentication authentication, Long artworkId) {
        User moderator = accessPolicy.requireModerator(authentication, "feature artworks");
        Artwork artwork = loadArtwork(artworkId);

        boolean featured = artwork.toggleFeatured();
        artworkRepository.saveAndFlush(artwork);

        log.info("Artwork {}: id={}, moderator={}", featured ? "featured" : "unfeatured", artworkId, moderator.getId());
        return new FeatureToggleResponse(
                String.format("Artwork %s successfully", featured ? "featured" : "unfeatured"),
                featured);
    }

    /**
     * Moderation log of one artwork, newest entry first.
     */
    @Transactional(readOnly = true)
    public List<ModerationResponse> history(Authentication authentication, Long artworkId) {
        accessPolicy.requireModerator(authentication, "view moderation history");
        if (!artworkRepository.existsById(artworkId)) {
            throw ResourceNotFoundException.artwork(artworkId);
        }
        return moderationRepository.findByArtworkIdOrderByCreatedAtDescIdDesc(artworkId).stream()
                .map(ModerationResponse::from)
                .toList();
    }

    private Artwork loadArtwork(Long artworkId) {
        return artworkRepository.findWithArtistById(artworkId)
                .orElseThrow(() -> ResourceNotFoundException.artwork(artworkId));
    }
}
