package com.artgrid.service;

import com.artgrid.dto.response.LikeToggleResponse;
import com.artgrid.entity.Artwork;
import com.artgrid.entity.ArtworkLike;
import com.artgrid.entity.User;
import com.artgrid.repository.ArtworkLikeRepository;
import com.artgrid.repository.ArtworkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Like toggling.
 *
 * After every toggle the artwork's likes_count is rewritten from the likes table in
 * the same transaction, so the counter always equals the number of like rows. A
 * concurrent duplicate like is rejected by the unique (user, artwork) index and
 * surfaces as 409.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LikeService {

    private final ArtworkRepository artworkRepository;
    private final ArtworkLikeRepository likeRepository;
    private final ArtworkService artworkService;
    private final AccessPolicy accessPolicy;

    /**
     * Like the artwork if the caller has not liked it yet, otherwise remove the like.
     *
     * @param authentication the caller
     * @param artworkId the artwork ID
     * @return whether the artwork is now liked and the resulting like count
     * @throws com.artgrid.exception.ResourceNotFoundException if the artwork is missing or not approved
     */
    @Transactional
    public LikeToggleResponse toggleLike(Authentication authentication, Long artworkId) {
        User user = accessPolicy.currentUser(authentication);
        Artwork artwork = artworkService.requireApproved(artworkId);

        boolean liked;
        if (likeRepository.deleteByUserIdAndArtworkId(user.getId(), artworkId) > 0) {
            liked = false;
        } else {
            likeRepository.saveAndFlush(new ArtworkLike(user, artwork));
            liked = true;
        }

        artworkRepository.recomputeLikesCount(artworkId);
        Integer likesCount = artworkRepository.findLikesCountById(artworkId);

        log.info("Like toggled: user={}, artwork={}, liked={}, likesCount={}",
                user.getId(), artworkId, liked, likesCount);
        return new LikeToggleResponse(liked, likesCount != null ? likesCount : 0);
    }
}
