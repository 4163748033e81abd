package com.artgrid.dto.response;

import com.artgrid.entity.Comment;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A comment with its author.
 *
 * {@code artwork_id} and {@code is_flagged} only appear in the moderator listing of
 * flagged comments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommentResponse {

    private Long id;
    private String content;
    private LocalDateTime timestamp;
    private Author user;
    private Long artworkId;
    private Boolean isFlagged;

    public static CommentResponse from(Comment comment) {
        return CommentResponse.builder()
                .id(comment.getId())
                .content(comment.getContent())
                .timestamp(comment.getCreatedAt())
                .user(new Author(comment.getUser().getId(), comment.getUser().getFullName()))
                .build();
    }

    public static CommentResponse forModeration(Comment comment) {
        CommentResponse response = from(comment);
        response.setArtworkId(comment.getArtwork().getId());
        response.setIsFlagged(comment.getFlagged());
        return response;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Author {
        private Long id;
        private String fullName;
    }
}
