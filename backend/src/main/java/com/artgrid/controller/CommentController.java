package com.artgrid.controller;

import com.artgrid.dto.request.CommentRequest;
import com.artgrid.dto.response.CommentListResponse;
import com.artgrid.dto.response.CommentResponse;
import com.artgrid.service.CommentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/comments")
@RequiredArgsConstructor
@Slf4j
public class CommentController {

    private final CommentService commentService;

    /**
     * Add a comment to an approved artwork.
     *
     * Endpoint: POST /api/comments
     * Authentication: Required (JWT token)
     *
     * A comment matching the content filter is stored and returned with 201 like any
     * other, but does not appear in the public listing.
     */
    @PostMapping
    public ResponseEntity<CommentResponse> addComment(
            @Valid @RequestBody CommentRequest request,
            Authentication authentication) {
        log.info("Comment requested on artwork: {} by user: {}", request.getArtworkId(), authentication.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(commentService.addComment(authentication, request));
    }

    @GetMapping("/{artworkId}")
    public ResponseEntity<CommentListResponse> listComments(@PathVariable Long artworkId) {
        return ResponseEntity.ok(commentService.listComments(artworkId));
    }
}
