package com.artgrid.integration;

import com.artgrid.entity.Artwork;
import com.artgrid.entity.User;
import com.artgrid.repository.ArtworkLikeRepository;
import com.artgrid.repository.ArtworkRepository;
import com.artgrid.repository.CommentRepository;
import com.artgrid.repository.ModerationRepository;
import com.artgrid.repository.UserRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-End Integration Test for the artwork lifecycle.
 *
 * This test verifies:
 * 1. Uploads by unverified students stay hidden until a moderator approves them
 * 2. Approve and reject happen once, each with one moderation log entry
 * 3. likes_count always equals the number of like rows, views count every fetch
 * 4. Flagged comments are stored but hidden from the public listing
 * 5. Deleting a user removes everything that references them
 *
 * Runs against an in-memory H2 database with local file storage and mail disabled.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("Artwork Lifecycle Integration Tests")
class ArtworkLifecycleIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ArtworkRepository artworkRepository;

    @Autowired
    private ArtworkLikeRepository likeRepository;

    @Autowired
    private CommentRepository commentRepository;

    @Autowired
    private ModerationRepository moderationRepository;

    @Test
    @DisplayName("Pending upload should become public only after approval")
    void testUploadApproveFlow() {
        // Upload as unverified student
        String email = uniqueEmail("artist");
        register(email);
        String token = login(email, PASSWORD);

        ResponseEntity<JsonNode> uploaded = upload(token, "Quiet Harbor", "Digital Art");
        assertEquals(HttpStatus.CREATED, uploaded.getStatusCode());
        assertEquals("pending", uploaded.getBody().get("status").asText());
        long artworkId = uploaded.getBody().get("artwork_id").asLong();

        // Hidden while pending
        assertEquals(HttpStatus.NOT_FOUND, get("/api/artworks/" + artworkId, null).getStatusCode());
        assertEquals(0, moderationRepository.countByArtworkId(artworkId));

        // Queue shows it to moderators
        String admin = adminToken();
        ResponseEntity<JsonNode> queue = get("/api/admin/queue?per_page=100", admin);
        assertEquals(HttpStatus.OK, queue.getStatusCode());
        boolean queued = false;
        for (JsonNode item : queue.getBody().get("artworks")) {
            queued |= item.get("id").asLong() == artworkId;
        }
        assertTrue(queued);

        // Approve
        ResponseEntity<JsonNode> approved = exchange("/api/admin/approve/" + artworkId, HttpMethod.PUT, null, admin);
        assertEquals(HttpStatus.OK, approved.getStatusCode());

        ResponseEntity<JsonNode> fetched = get("/api/artworks/" + artworkId, null);
        assertEquals(HttpStatus.OK, fetched.getStatusCode());
        assertFalse(fetched.getBody().get("approval_date").isNull());
        assertEquals("Quiet Harbor", fetched.getBody().get("title").asText());
        assertTrue(fetched.getBody().get("file_url").asText().startsWith("/uploads/artworks/"));

        ResponseEntity<JsonNode> history = get("/api/admin/artworks/" + artworkId + "/moderations", admin);
        assertEquals(HttpStatus.OK, history.getStatusCode());
        assertEquals(1, history.getBody().size());
        assertEquals("approved", history.getBody().get(0).get("action").asText());
    }

    @Test
    @DisplayName("A second moderation decision should be refused with 400 and no extra log entry")
    void testDoubleTransitionRefused() {
        String email = uniqueEmail("double");
        register(email);
        long artworkId = uploadApproved(login(email, PASSWORD), "Once Only");
        String admin = adminToken();

        ResponseEntity<JsonNode> again = exchange("/api/admin/approve/" + artworkId, HttpMethod.PUT, null, admin);
        ResponseEntity<JsonNode> reject = exchange("/api/admin/reject/" + artworkId, HttpMethod.PUT,
                Map.of("feedback", "too late"), admin);

        assertEquals(HttpStatus.BAD_REQUEST, again.getStatusCode());
        assertEquals("approved", again.getBody().get("currentStatus").asText());
        assertEquals(HttpStatus.BAD_REQUEST, reject.getStatusCode());
        assertEquals(1, moderationRepository.countByArtworkId(artworkId));
        assertEquals(Artwork.Status.APPROVED, artworkRepository.findById(artworkId).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Rejected artwork should keep the feedback and stay hidden")
    void testReject() {
        String email = uniqueEmail("rejected");
        register(email);
        ResponseEntity<JsonNode> uploaded = upload(login(email, PASSWORD), "Draft", "Drawing");
        long artworkId = uploaded.getBody().get("artwork_id").asLong();

        ResponseEntity<JsonNode> rejected = exchange("/api/admin/reject/" + artworkId, HttpMethod.PUT,
                Map.of("feedback", "Please add a title card"), adminToken());

        assertEquals(HttpStatus.OK, rejected.getStatusCode());
        Artwork artwork = artworkRepository.findById(artworkId).orElseThrow();
        assertEquals(Artwork.Status.REJECTED, artwork.getStatus());
        assertEquals("Please add a title card", artwork.getRejectionFeedback());
        assertNull(artwork.getApprovalDate());
        assertEquals(HttpStatus.NOT_FOUND, get("/api/artworks/" + artworkId, null).getStatusCode());
    }

    @Test
    @DisplayName("Verified students should be published without review")
    void testVerifiedUploadAutoApproved() {
        String email = uniqueEmail("verified");
        long userId = register(email);
        assertEquals(HttpStatus.OK, exchange("/api/admin/users/" + userId + "/verify", HttpMethod.PUT, null,
                adminToken()).getStatusCode());

        ResponseEntity<JsonNode> uploaded = upload(login(email, PASSWORD), "Straight Through", "Painting");

        assertEquals(HttpStatus.CREATED, uploaded.getStatusCode());
        assertEquals("approved", uploaded.getBody().get("status").asText());
        long artworkId = uploaded.getBody().get("artwork_id").asLong();
        assertEquals(HttpStatus.OK, get("/api/artworks/" + artworkId, null).getStatusCode());
    }

    @Test
    @DisplayName("Upload with a disallowed file type should return 400")
    void testUpload_Validation() {
        String email = uniqueEmail("badfile");
        register(email);
        String token = login(email, PASSWORD);

        ResponseEntity<JsonNode> missingFields = upload(token, "", "Painting");

        assertEquals(HttpStatus.BAD_REQUEST, missingFields.getStatusCode());
        assertEquals("Title, medium, and category are required", missingFields.getBody().get("detail").asText());
    }

    @Test
    @DisplayName("likes_count should always equal the number of like rows")
    void testLikeToggleKeepsCounterInSync() {
        String artistEmail = uniqueEmail("liked");
        register(artistEmail);
        long artworkId = uploadApproved(login(artistEmail, PASSWORD), "Likeable");

        String fanA = uniqueEmail("fan-a");
        String fanB = uniqueEmail("fan-b");
        register(fanA);
        register(fanB);
        String tokenA = login(fanA, PASSWORD);
        String tokenB = login(fanB, PASSWORD);

        ResponseEntity<JsonNode> likeA = post("/api/artworks/" + artworkId + "/like", null, tokenA);
        assertEquals(HttpStatus.OK, likeA.getStatusCode());
        assertTrue(likeA.getBody().get("liked").asBoolean());
        assertEquals(1, likeA.getBody().get("likes_count").asInt());

        ResponseEntity<JsonNode> likeB = post("/api/artworks/" + artworkId + "/like", null, tokenB);
        assertEquals(2, likeB.getBody().get("likes_count").asInt());
        assertCounterMatchesRows(artworkId);

        ResponseEntity<JsonNode> unlikeA = post("/api/artworks/" + artworkId + "/like", null, tokenA);
        assertFalse(unlikeA.getBody().get("liked").asBoolean());
        assertEquals(1, unlikeA.getBody().get("likes_count").asInt());
        assertCounterMatchesRows(artworkId);

        ResponseEntity<JsonNode> relikeA = post("/api/artworks/" + artworkId + "/like", null, tokenA);
        assertTrue(relikeA.getBody().get("liked").asBoolean());
        assertEquals(2, relikeA.getBody().get("likes_count").asInt());
        assertCounterMatchesRows(artworkId);
    }

    @Test
    @DisplayName("Liking a pending artwork should return 404")
    void testLikePendingArtwork() {
        String email = uniqueEmail("pending-like");
        register(email);
        String token = login(email, PASSWORD);
        long artworkId = upload(token, "Not Yet", "Painting").getBody().get("artwork_id").asLong();

        assertEquals(HttpStatus.NOT_FOUND, post("/api/artworks/" + artworkId + "/like", null, token).getStatusCode());
        assertEquals(0, likeRepository.countByArtworkId(artworkId));
    }

    @Test
    @DisplayName("Every fetch should increment views_count by one")
    void testViewsIncrement() {
        String email = uniqueEmail("viewed");
        register(email);
        long artworkId = uploadApproved(login(email, PASSWORD), "Watched");

        int first = get("/api/artworks/" + artworkId, null).getBody().get("views_count").asInt();
        int second = get("/api/artworks/" + artworkId, null).getBody().get("views_count").asInt();

        assertEquals(1, first);
        assertEquals(2, second);
    }

    @Test
    @DisplayName("Flagged comments should be stored but hidden from the public listing")
    void testFlaggedCommentHidden() {
        String email = uniqueEmail("commenter");
        register(email);
        String token = login(email, PASSWORD);
        long artworkId = uploadApproved(token, "Discussed");

        ResponseEntity<JsonNode> clean = post("/api/comments",
                Map.of("artwork_id", artworkId, "content", "Beautiful light"), token);
        ResponseEntity<JsonNode> spam = post("/api/comments",
                Map.of("artwork_id", artworkId, "content", "Cheap SPAM offers here"), token);
        assertEquals(HttpStatus.CREATED, clean.getStatusCode());
        assertEquals(HttpStatus.CREATED, spam.getStatusCode());

        ResponseEntity<JsonNode> listing = get("/api/comments/" + artworkId, null);
        assertEquals(HttpStatus.OK, listing.getStatusCode());
        JsonNode comments = listing.getBody().get("comments");
        assertEquals(1, comments.size());
        assertEquals("Beautiful light", comments.get(0).get("content").asText());

        long spamId = spam.getBody().get("id").asLong();
        assertTrue(commentRepository.findById(spamId).orElseThrow().getFlagged());

        ResponseEntity<JsonNode> flagged = get("/api/admin/comments/flagged?per_page=100", adminToken());
        assertEquals(HttpStatus.OK, flagged.getStatusCode());
        boolean found = false;
        for (JsonNode comment : flagged.getBody().get("comments")) {
            found |= comment.get("id").asLong() == spamId;
        }
        assertTrue(found);
    }

    @Test
    @DisplayName("Comment without content should return 400")
    void testComment_MissingContent() {
        String email = uniqueEmail("empty-comment");
        register(email);

        ResponseEntity<JsonNode> response = post("/api/comments", Map.of("content", "no artwork"),
                login(email, PASSWORD));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    @DisplayName("Featured artworks should be listed by the featured filter")
    void testFeatureToggle() {
        String email = uniqueEmail("featured");
        register(email);
        long artworkId = uploadApproved(login(email, PASSWORD), "Front Page");
        String admin = adminToken();

        ResponseEntity<JsonNode> toggled = post("/api/admin/feature/" + artworkId, null, admin);
        assertEquals(HttpStatus.OK, toggled.getStatusCode());
        assertTrue(toggled.getBody().get("is_featured").asBoolean());

        ResponseEntity<JsonNode> listing = get("/api/artworks?featured=true&per_page=100", null);
        boolean listed = false;
        for (JsonNode item : listing.getBody().get("artworks")) {
            listed |= item.get("id").asLong() == artworkId;
            assertTrue(item.get("is_featured").asBoolean());
        }
        assertTrue(listed);
    }

    @Test
    @DisplayName("Gallery should show only approved artworks of the user")
    void testGallery() {
        String email = uniqueEmail("gallery");
        long userId = register(email);
        String token = login(email, PASSWORD);
        long approvedId = uploadApproved(token, "Shown");
        upload(token, "Still Pending", "Painting");

        ResponseEntity<JsonNode> gallery = get("/api/users/" + userId + "/gallery", null);

        assertEquals(HttpStatus.OK, gallery.getStatusCode());
        assertEquals(userId, gallery.getBody().get("user").get("id").asLong());
        JsonNode artworks = gallery.getBody().get("artworks");
        assertEquals(1, artworks.size());
        assertEquals(approvedId, artworks.get(0).get("id").asLong());
        assertEquals(HttpStatus.NOT_FOUND, get("/api/users/999999/gallery", null).getStatusCode());
    }

    @Test
    @DisplayName("Deleting a user should remove their artworks, likes and comments")
    void testDeleteUserCascade() {
        // Two artists with one approved artwork each
        String doomedEmail = uniqueEmail("doomed");
        long doomedId = register(doomedEmail);
        String doomedToken = login(doomedEmail, PASSWORD);
        long doomedArtwork = uploadApproved(doomedToken, "Going Away");

        String survivorEmail = uniqueEmail("survivor");
        register(survivorEmail);
        String survivorToken = login(survivorEmail, PASSWORD);
        long survivorArtwork = uploadApproved(survivorToken, "Staying");

        // Cross likes and comments
        post("/api/artworks/" + survivorArtwork + "/like", null, doomedToken);
        post("/api/artworks/" + doomedArtwork + "/like", null, survivorToken);
        post("/api/comments", Map.of("artwork_id", survivorArtwork, "content", "from the doomed"), doomedToken);
        post("/api/comments", Map.of("artwork_id", doomedArtwork, "content", "on the doomed"), survivorToken);
        assertEquals(1, artworkRepository.findLikesCountById(survivorArtwork).intValue());

        // Delete
        ResponseEntity<JsonNode> deleted = exchange("/api/admin/users/" + doomedId, HttpMethod.DELETE, null, adminToken());
        assertEquals(HttpStatus.OK, deleted.getStatusCode());

        // Verify
        assertFalse(userRepository.existsById(doomedId));
        assertFalse(artworkRepository.existsById(doomedArtwork));
        assertEquals(0, moderationRepository.countByArtworkId(doomedArtwork));
        assertEquals(0, likeRepository.countByArtworkId(survivorArtwork));
        assertEquals(0, artworkRepository.findLikesCountById(survivorArtwork).intValue());
        assertEquals(0, get("/api/comments/" + survivorArtwork, null).getBody().get("comments").size());
        assertEquals(HttpStatus.NOT_FOUND, get("/api/users/" + doomedId + "/gallery", null).getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, get("/api/auth/profile", doomedToken).getStatusCode());
    }

    @Test
    @DisplayName("Deleting a moderator should keep their decisions with the moderator cleared")
    void testDeleteModeratorKeepsLog() {
        // Artist and a moderator who reviews the artwork
        String artistEmail = uniqueEmail("logged");
        register(artistEmail);
        long artworkId = upload(login(artistEmail, PASSWORD), "Reviewed", "Painting")
                .getBody().get("artwork_id").asLong();

        String modEmail = uniqueEmail("mod");
        long modId = register(modEmail);
        userRepository.findById(modId).ifPresent(user -> {
            user.setRole(User.Role.MODERATOR);
            userRepository.save(user);
        });
        String modToken = login(modEmail, PASSWORD);
        assertEquals(HttpStatus.OK,
                exchange("/api/admin/approve/" + artworkId, HttpMethod.PUT, null, modToken).getStatusCode());

        // Moderators cannot delete users, administrators can
        String admin = adminToken();
        assertEquals(HttpStatus.OK, exchange("/api/admin/users/" + modId, HttpMethod.DELETE, null, admin).getStatusCode());

        JsonNode history = get("/api/admin/artworks/" + artworkId + "/moderations", admin).getBody();
        assertEquals(1, history.size());
        assertTrue(history.get(0).get("moderator_id") == null || history.get(0).get("moderator_id").isNull());
    }

    private void assertCounterMatchesRows(long artworkId) {
        assertEquals(likeRepository.countByArtworkId(artworkId),
                (long) artworkRepository.findLikesCountById(artworkId));
    }
}
