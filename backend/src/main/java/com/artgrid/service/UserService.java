package com.artgrid.service;

import com.artgrid.dto.response.ArtistSummary;
import com.artgrid.dto.response.ArtworkResponse;
import com.artgrid.dto.response.GalleryResponse;
import com.artgrid.dto.response.MessageResponse;
import com.artgrid.entity.Artwork;
import com.artgrid.entity.User;
import com.artgrid.exception.ResourceNotFoundException;
import com.artgrid.exception.UnauthorizedException;
import com.artgrid.repository.ArtworkLikeRepository;
import com.artgrid.repository.ArtworkRepository;
import com.artgrid.repository.CommentRepository;
import com.artgrid.repository.ModerationRepository;
import com.artgrid.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * User galleries and account administration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final ArtworkRepository artworkRepository;
    private final ArtworkLikeRepository likeRepository;
    private final CommentRepository commentRepository;
    private final ModerationRepository moderationRepository;
    private final AccessPolicy accessPolicy;

    /**
     * Public gallery of a user: profile plus approved artworks, newest first.
     *
     * @throws ResourceNotFoundException if the user does not exist
     */
    @Transactional(readOnly = true)
    public GalleryResponse gallery(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.user(userId));

        List<ArtworkResponse> artworks = artworkRepository
                .findByArtistIdAndStatusOrderBySubmissionDateDescIdDesc(userId, Artwork.Status.APPROVED).stream()
                .map(ArtworkResponse::withoutArtist)
                .toList();

        return new GalleryResponse(ArtistSummary.publicView(user), artworks);
    }

    /**
     * Mark a user as verified. Later uploads by that user are published without review.
     */
    @Transactional
    public MessageResponse verifyUser(Authentication authentication, Long userId) {
        User admin = accessPolicy.requireAdmin(authentication, "verify users");
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.user(userId));

        user.setVerificationStatus(User.VerificationStatus.VERIFIED);
        userRepository.save(user);

        log.info("User verified: id={}, by admin={}", userId, admin.getId());
        return new MessageResponse("User verified successfully");
    }

    /**
     * Delete a user together with everything that references them.
     *
     * Runs in one transaction, in this order:
     * <ol>
     *   <li>likes given by the user</li>
     *   <li>comments written by the user</li>
     *   <li>likes, comments and moderation entries on the user's artworks</li>
     *   <li>the user's artworks</li>
     *   <li>moderation entries authored by the user are kept, with the moderator cleared</li>
     *   <li>likes_count of the artworks the user had liked is recomputed</li>
     *   <li>the user</li>
     * </ol>
     *
     * @param authentication the administrator
     * @param userId the user to delete
     * @throws UnauthorizedException if the caller is not an administrator or targets themselves
     * @throws ResourceNotFoundException if the user does not exist
     */
    @Transactional
    public MessageResponse deleteUser(Authentication authentication, Long userId) {
        User admin = accessPolicy.requireAdmin(authentication, "delete users");
        if (admin.getId().equals(userId)) {
            throw UnauthorizedException.selfDeletion();
        }
        if (!userRepository.existsById(userId)) {
            throw ResourceNotFoundException.user(userId);
        }

        List<Long> likedArtworkIds = new ArrayList<>(likeRepository.findLikedArtworkIds(userId));
        List<Long> ownArtworkIds = artworkRepository.findIdsByArtistId(userId);

        int likes = likeRepository.deleteByUserId(userId);
        int comments = commentRepository.deleteByUserId(userId);

        if (!ownArtworkIds.isEmpty()) {
            likeRepository.deleteByArtworkIds(ownArtworkIds);
            commentRepository.deleteByArtworkIds(ownArtworkIds);
            moderationRepository.deleteByArtworkIds(ownArtworkIds);
            artworkRepository.deleteByArtistId(userId);
        }

        moderationRepository.detachModerator(userId);

        likedArtworkIds.removeAll(ownArtworkIds);
        if (!likedArtworkIds.isEmpty()) {
            artworkRepository.recomputeLikesCounts(likedArtworkIds);
        }

        userRepository.deleteById(userId);

        log.info("User deleted: id={}, by admin={}, artworks={}, likes={}, comments={}",
                userId, admin.getId(), ownArtworkIds.size(), likes, comments);
        return new MessageResponse("User deleted successfully");
    }
}
