package com.artgrid.service;

import com.artgrid.dto.response.AdminStatsResponse;
import com.artgrid.entity.Artwork;
import com.artgrid.repository.ArtworkLikeRepository;
import com.artgrid.repository.ArtworkRepository;
import com.artgrid.repository.CommentRepository;
import com.artgrid.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Platform statistics, computed on demand.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminStatsService {

    private final UserRepository userRepository;
    private final ArtworkRepository artworkRepository;
    private final ArtworkLikeRepository likeRepository;
    private final CommentRepository commentRepository;
    private final AccessPolicy accessPolicy;

    @Transactional(readOnly = true)
    public AdminStatsResponse stats(Authentication authentication) {
        accessPolicy.requireModerator(authentication, "view statistics");

        AdminStatsResponse.Overview overview = AdminStatsResponse.Overview.builder()
                .totalUsers(userRepository.count())
                .totalArtworks(artworkRepository.count())
                .pendingArtworks(artworkRepository.countByStatus(Artwork.Status.PENDING))
                .approvedArtworks(artworkRepository.countByStatus(Artwork.Status.APPROVED))
                .rejectedArtworks(artworkRepository.countByStatus(Artwork.Status.REJECTED))
                .featuredArtworks(artworkRepository.countByFeaturedTrue())
                .totalLikes(likeRepository.count())
                .totalComments(commentRepository.count())
                .flaggedComments(commentRepository.countByFlaggedTrue())
                .build();

        AdminStatsResponse response = AdminStatsResponse.builder()
                .overview(overview)
                .yearStats(artworkRepository.countByArtistYearOfStudy(Artwork.Status.APPROVED).stream()
                        .map(row -> new AdminStatsResponse.YearCount(row.getLabel(), row.getTotal()))
                        .toList())
                .categoryStats(artworkRepository.countByCategory(Artwork.Status.APPROVED).stream()
                        .map(row -> new AdminStatsResponse.CategoryCount(row.getLabel(), row.getTotal()))
                        .toList())
                .topArtworks(artworkRepository.findTop10ByStatusOrderByLikesCountDesc(Artwork.Status.APPROVED).stream()
                        .map(artwork -> new AdminStatsResponse.TopArtwork(
                                artwork.getId(),
                                artwork.getTitle(),
                                artwork.getLikesCount(),
                                artwork.getViewsCount(),
                                artwork.getArtist().getFullName()))
                        .toList())
                .build();

        log.debug("Stats computed: users={}, artworks={}", overview.getTotalUsers(), overview.getTotalArtworks());
        return response;
    }
}
