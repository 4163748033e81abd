package com.artgrid.controller;

import com.artgrid.dto.request.RejectRequest;
import com.artgrid.dto.response.AdminStatsResponse;
import com.artgrid.dto.response.ArtworkPageResponse;
import com.artgrid.dto.response.CommentListResponse;
import com.artgrid.dto.response.FeatureToggleResponse;
import com.artgrid.dto.response.MessageResponse;
import com.artgrid.dto.response.ModerationResponse;
import com.artgrid.exception.InvalidStateException;
import com.artgrid.service.AdminStatsService;
import com.artgrid.service.CommentService;
import com.artgrid.service.ModerationService;
import com.artgrid.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for moderation and administration.
 *
 * Every endpoint requires a bearer token. Moderation endpoints additionally require
 * the moderator or admin role, user administration requires the admin role; both are
 * checked in the service layer against the stored role.
 *
 * Error Responses:
 * - 400 Bad Request: transition from the wrong status (e.g. approving a rejected artwork)
 * - 401 Unauthorized: missing or invalid token
 * - 403 Forbidden: caller lacks the required role
 * - 404 Not Found: unknown artwork or user
 * - 409 Conflict: another moderator decided on the same artwork concurrently
 *
 * @see com.artgrid.service.ModerationService
 * @see com.artgrid.service.AccessPolicy
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final ModerationService moderationService;
    private final AdminStatsService adminStatsService;
    private final CommentService commentService;
    private final UserService userService;

    /**
     * Pending artworks, oldest first.
     *
     * Endpoint: GET /api/admin/queue?page=1&amp;per_page=10
     */
    @GetMapping("/queue")
    public ResponseEntity<ArtworkPageResponse> queue(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "10") int perPage,
            Authentication authentication) {
        return ResponseEntity.ok(moderationService.queue(authentication, page, perPage));
    }

    @PutMapping("/approve/{id}")
    public ResponseEntity<MessageResponse> approve(@PathVariable Long id, Authentication authentication) {
        log.info("Approval requested for artwork: {} by user: {}", id, authentication.getName());

        try {
            return ResponseEntity.ok(moderationService.approve(authentication, id));

        } catch (InvalidStateException e) {
            log.warn("Approval refused for artwork {}: {}", id, e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    /**
     * Reject a pending artwork.
     *
     * Endpoint: PUT /api/admin/reject/{id}
     *
     * Example request:
     * <pre>
     * { "feedback": "Please crop the watermark." }
     * </pre>
     * The body may be omitted.
     */
    @PutMapping("/reject/{id}")
    public ResponseEntity<MessageResponse> reject(
            @PathVariable Long id,
            @RequestBody(required = false) RejectRequest request,
            Authentication authentication) {
        log.info("Rejection requested for artwork: {} by user: {}", id, authentication.getName());

        try {
            String feedback = request != null ? request.getFeedback() : null;
            return ResponseEntity.ok(moderationService.reject(authentication, id, feedback));

        } catch (InvalidStateException e) {
            log.warn("Rejection refused for artwork {}: {}", id, e.getMessage());
            throw e;  // GlobalExceptionHandler will handle this
        }
    }

    @PostMapping("/feature/{id}")
    public ResponseEntity<FeatureToggleResponse> toggleFeatured(@PathVariable Long id, Authentication authentication) {
        log.info("Feature toggle requested for artwork: {} by user: {}", id, authentication.getName());
        return ResponseEntity.ok(moderationService.toggleFeatured(authentication, id));
    }

    @GetMapping("/stats")
    public ResponseEntity<AdminStatsResponse> stats(Authentication authentication) {
        return ResponseEntity.ok(adminStatsService.stats(authentication));
    }

    @GetMapping("/artworks/{id}/moderations")
    public ResponseEntity<List<ModerationResponse>> moderationHistory(
            @PathVariable Long id,
            Authentication authentication) {
        return ResponseEntity.ok(moderationService.history(authentication, id));
    }

    @GetMapping("/comments/flagged")
    public ResponseEntity<CommentListResponse> flaggedComments(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "20") int perPage,
            Authentication authentication) {
        return ResponseEntity.ok(commentService.flaggedComments(authentication, page, perPage));
    }

    @PutMapping("/users/{id}/verify")
    public ResponseEntity<MessageResponse> verifyUser(@PathVariable Long id, Authentication authentication) {
        log.info("Verification requested for user: {} by user: {}", id, authentication.getName());
        return ResponseEntity.ok(userService.verifyUser(authentication, id));
    }

    /**
     * Delete a user and everything that references them.
     *
     * Endpoint: DELETE /api/admin/users/{id}
     * Authentication: admin role
     */
    @DeleteMapping("/users/{id}")
    public ResponseEntity<MessageResponse> deleteUser(@PathVariable Long id, Authentication authentication) {
        log.info("Deletion requested for user: {} by user: {}", id, authentication.getName());
        return ResponseEntity.ok(userService.deleteUser(authentication, id));
    }
}
