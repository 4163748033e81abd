package com.artgrid.integration;

import com.artgrid.entity.Artwork;
import com.artgrid.entity.ArtworkLike;
import com.artgrid.entity.User;
import com.artgrid.repository.ArtworkLikeRepository;
import com.artgrid.repository.ArtworkRepository;
import com.artgrid.repository.UserRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests against a real SQLite database file.
 *
 * This test verifies:
 * 1. schema.sql creates the unique like index and the foreign keys, and they are enforced
 * 2. Concurrent like toggles all succeed and leave likes_count equal to the like rows
 * 3. A stale artwork version is rejected instead of overwriting a newer decision
 *
 * Uses the production connection flags (WAL, busy timeout, IMMEDIATE transactions).
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles({"test", "sqlite"})
@DisplayName("SQLite Concurrency Integration Tests")
class SqliteConcurrencyIntegrationTest extends IntegrationTestSupport {

    private static final int CONCURRENT_USERS = 12;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ArtworkRepository artworkRepository;

    @Autowired
    private ArtworkLikeRepository likeRepository;

    @Test
    @DisplayName("likes table should carry the unique (user, artwork) index and both foreign keys")
    void testLikeConstraintsExist() {
        List<Map<String, Object>> foreignKeys = jdbcTemplate.queryForList("PRAGMA foreign_key_list('likes')");
        Set<String> referenced = foreignKeys.stream()
                .map(row -> (String) row.get("table"))
                .collect(Collectors.toSet());
        assertEquals(Set.of("users", "artworks"), referenced);

        List<Map<String, Object>> indexes = jdbcTemplate.queryForList("PRAGMA index_list('likes')");
        assertTrue(indexes.stream().anyMatch(row ->
                        ((Number) row.get("unique")).intValue() == 1 && "u".equals(row.get("origin"))),
                "expected a UNIQUE constraint index on likes, got " + indexes);

        assertEquals(1, jdbcTemplate.queryForObject("PRAGMA foreign_keys", Integer.class).intValue());
    }

    @Test
    @DisplayName("users table should have unique email and student ID indexes")
    void testUserUniqueIndexesExist() {
        List<Map<String, Object>> indexes = jdbcTemplate.queryForList("PRAGMA index_list('users')");
        Set<String> uniqueIndexes = indexes.stream()
                .filter(row -> ((Number) row.get("unique")).intValue() == 1)
                .map(row -> (String) row.get("name"))
                .collect(Collectors.toSet());

        assertTrue(uniqueIndexes.containsAll(Set.of("idx_user_email", "idx_user_student_id")),
                "unexpected unique indexes: " + uniqueIndexes);
    }

    @Test
    @DisplayName("a second like row for the same user and artwork should be a data integrity violation")
    void testDuplicateLikeRejected() {
        String email = uniqueEmail("dup");
        long userId = register(email);
        long artworkId = uploadApproved(login(email, PASSWORD), "Duplicate Target");
        User user = userRepository.findById(userId).orElseThrow();
        Artwork artwork = artworkRepository.findById(artworkId).orElseThrow();

        likeRepository.saveAndFlush(new ArtworkLike(user, artwork));

        assertThrows(DataIntegrityViolationException.class,
                () -> likeRepository.saveAndFlush(new ArtworkLike(user, artwork)));
        assertEquals(1, likeRepository.countByArtworkId(artworkId));
    }

    @Test
    @DisplayName("a like pointing at a missing artwork should be refused by the foreign key")
    void testForeignKeyEnforced() {
        long userId = register(uniqueEmail("fk"));

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "INSERT INTO likes (user_id, artwork_id, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
                userId, 999_999L));
    }

    @Test
    @DisplayName("concurrent likes from different users should all succeed and be counted")
    void testConcurrentLikes() throws Exception {
        // Arrange
        String artistEmail = uniqueEmail("popular");
        register(artistEmail);
        long artworkId = uploadApproved(login(artistEmail, PASSWORD), "Crowd Favourite");

        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < CONCURRENT_USERS; i++) {
            String email = uniqueEmail("fan" + i);
            register(email);
            tokens.add(login(email, PASSWORD));
        }

        // Act
        List<HttpStatus> statuses = likeConcurrently(artworkId, tokens);

        // Assert
        assertTrue(statuses.stream().allMatch(HttpStatus.OK::equals), "unexpected statuses: " + statuses);
        assertEquals(CONCURRENT_USERS, likeRepository.countByArtworkId(artworkId));
        assertEquals(CONCURRENT_USERS, artworkRepository.findLikesCountById(artworkId).intValue());

        ResponseEntity<JsonNode> detail = get("/api/artworks/" + artworkId, null);
        assertEquals(CONCURRENT_USERS, detail.getBody().get("likes_count").asInt());
    }

    @Test
    @DisplayName("concurrent toggles by one user should leave at most one like and a matching count")
    void testConcurrentTogglesSameUser() throws Exception {
        String email = uniqueEmail("toggler");
        register(email);
        String token = login(email, PASSWORD);
        long artworkId = uploadApproved(token, "Flip Flop");

        List<HttpStatus> statuses = likeConcurrently(artworkId, List.of(token, token, token, token, token, token));

        assertTrue(statuses.stream().allMatch(HttpStatus.OK::equals), "unexpected statuses: " + statuses);
        long rows = likeRepository.countByArtworkId(artworkId);
        assertTrue(rows == 0 || rows == 1);
        assertEquals(rows, artworkRepository.findLikesCountById(artworkId).longValue());
    }

    @Test
    @DisplayName("saving an artwork loaded before a newer change should fail with an optimistic lock error")
    void testStaleVersionRejected() {
        String email = uniqueEmail("versioned");
        register(email);
        long artworkId = uploadApproved(login(email, PASSWORD), "Versioned Piece");

        Artwork first = artworkRepository.findById(artworkId).orElseThrow();
        Artwork second = artworkRepository.findById(artworkId).orElseThrow();

        first.toggleFeatured();
        artworkRepository.saveAndFlush(first);

        second.toggleFeatured();
        assertThrows(OptimisticLockingFailureException.class, () -> artworkRepository.saveAndFlush(second));
        assertTrue(artworkRepository.findById(artworkId).orElseThrow().getFeatured());
    }

    private List<HttpStatus> likeConcurrently(long artworkId, List<String> tokens) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(tokens.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<HttpStatus>> futures = new ArrayList<>();
            for (String token : tokens) {
                futures.add(pool.submit(() -> {
                    start.await();
                    ResponseEntity<JsonNode> response = post("/api/artworks/" + artworkId + "/like", null, token);
                    return HttpStatus.valueOf(response.getStatusCode().value());
                }));
            }
            start.countDown();

            List<HttpStatus> statuses = new ArrayList<>();
            for (Future<HttpStatus> future : futures) {
                statuses.add(future.get(60, TimeUnit.SECONDS));
            }
            return statuses;
        } finally {
            pool.shutdownNow();
        }
    }
}
