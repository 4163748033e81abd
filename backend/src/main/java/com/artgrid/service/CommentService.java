package com.artgrid.service;

import com.artgrid.dto.request.CommentRequest;
import com.artgrid.dto.response.CommentListResponse;
import com.artgrid.dto.response.CommentResponse;
import com.artgrid.entity.Artwork;
import com.artgrid.entity.Comment;
import com.artgrid.entity.User;
import com.artgrid.repository.CommentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Comments on approved artworks.
 *
 * Every comment is stored. Those matched by the {@link ContentFilter} are flagged at
 * creation and left out of the public listing; moderators can still list them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommentService {

    private final CommentRepository commentRepository;
    private final ArtworkService artworkService;
    private final ContentFilter contentFilter;
    private final AccessPolicy accessPolicy;

    /**
     * @throws com.artgrid.exception.ResourceNotFoundException if the artwork is missing or not approved
     */
    @Transactional
    public CommentResponse addComment(Authentication authentication, CommentRequest request) {
        User user = accessPolicy.currentUser(authentication);
        Artwork artwork = artworkService.requireApproved(request.getArtworkId());

        boolean flagged = contentFilter.isFlagged(request.getContent());
        Comment comment = commentRepository.save(new Comment(user, artwork, request.getContent(), flagged));

        if (flagged) {
            log.warn("Comment flagged: id={}, user={}, artwork={}", comment.getId(), user.getId(), artwork.getId());
        } else {
            log.info("Comment added: id={}, user={}, artwork={}", comment.getId(), user.getId(), artwork.getId());
        }
        return CommentResponse.from(comment);
    }

    @Transactional(readOnly = true)
    public CommentListResponse listComments(Long artworkId) {
        artworkService.requireApproved(artworkId);
        return new CommentListResponse(
                commentRepository.findByArtworkIdAndFlaggedFalseOrderByCreatedAtDescIdDesc(artworkId).stream()
                        .map(CommentResponse::from)
                        .toList()
        );
    }

    /**
     * Flagged comments across all artworks, newest first.
     */
    @Transactional(readOnly = true)
    public CommentListResponse flaggedComments(Authentication authentication, int page, int perPage) {
        accessPolicy.requireModerator(authentication, "review flagged comments");
        return new CommentListResponse(
                commentRepository.findByFlaggedTrueOrderByCreatedAtDescIdDesc(
                                ArtworkService.pageRequest(page, perPage, Sort.unsorted()))
                        .map(CommentResponse::forModeration)
                        .getContent()
        );
    }
}
