package com.artgrid.repository;

import com.artgrid.entity.Artwork;
import com.artgrid.entity.Artwork.Status;
import com.artgrid.repository.projection.CountByLabelRow;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Artwork entity operations.
 *
 * Besides the browse and moderation queries this repository owns the only writes to
 * the engagement counters. Both counter updates are single SQL statements so that
 * concurrent requests cannot lose an increment:
 * <ul>
 *   <li>{@link #incrementViews(Long)} adds one to views_count in place</li>
 *   <li>{@link #recomputeLikesCount(Long)} rewrites likes_count from the likes table</li>
 * </ul>
 */
@Repository
public interface ArtworkRepository extends JpaRepository<Artwork, Long> {

    @EntityGraph(attributePaths = "artist")
    @Query("SELECT a FROM Artwork a WHERE a.id = :id")
    Optional<Artwork> findWithArtistById(@Param("id") Long id);

    /**
     * Public browse query. Null filters are ignored.
     *
     * @param status the status to list (always APPROVED for the public listing)
     * @param category optional category filter
     * @param medium optional medium filter
     * @param featuredOnly when true only featured artworks are returned
     * @param pageable pagination and sorting parameters
     * @return page of matching artworks
     */
    @EntityGraph(attributePaths = "artist")
    @Query(value = "SELECT a FROM Artwork a " +
           "WHERE a.status = :status " +
           "AND (:category IS NULL OR a.category = :category) " +
           "AND (:medium IS NULL OR a.medium = :medium) " +
           "AND (:featuredOnly = false OR a.featured = true)",
           countQuery = "SELECT COUNT(a) FROM Artwork a " +
           "WHERE a.status = :status " +
           "AND (:category IS NULL OR a.category = :category) " +
           "AND (:medium IS NULL OR a.medium = :medium) " +
           "AND (:featuredOnly = false OR a.featured = true)")
    Page<Artwork> findPublished(@Param("status") Status status,
                                @Param("category") String category,
                                @Param("medium") String medium,
                                @Param("featuredOnly") boolean featuredOnly,
                                Pageable pageable);

    /**
     * Moderation queue: oldest submissions first.
     */
    @EntityGraph(attributePaths = "artist")
    Page<Artwork> findByStatusOrderBySubmissionDateAscIdAsc(Status status, Pageable pageable);

    List<Artwork> findByArtistIdAndStatusOrderBySubmissionDateDescIdDesc(Long artistId, Status status);

    @EntityGraph(attributePaths = "artist")
    List<Artwork> findTop10ByStatusOrderByLikesCountDesc(Status status);

    long countByStatus(Status status);

    long countByFeaturedTrue();

    @Query("SELECT a.id FROM Artwork a WHERE a.artist.id = :artistId")
    List<Long> findIdsByArtistId(@Param("artistId") Long artistId);

    @Query("SELECT a.likesCount FROM Artwork a WHERE a.id = :id")
    Integer findLikesCountById(@Param("id") Long id);

    @Query("SELECT u.yearOfStudy AS label, COUNT(a) AS total FROM Artwork a JOIN a.artist u " +
           "WHERE a.status = :status GROUP BY u.yearOfStudy ORDER BY COUNT(a) DESC")
    List<CountByLabelRow> countByArtistYearOfStudy(@Param("status") Status status);

    @Query("SELECT a.category AS label, COUNT(a) AS total FROM Artwork a " +
           "WHERE a.status = :status GROUP BY a.category ORDER BY COUNT(a) DESC")
    List<CountByLabelRow> countByCategory(@Param("status") Status status);

    /**
     * Adds one view in place.
     *
     * @param id the artwork ID
     * @return number of updated rows (0 if the artwork does not exist)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE artworks SET views_count = views_count + 1 WHERE id = :id", nativeQuery = true)
    int incrementViews(@Param("id") Long id);

    /**
     * Rewrites likes_count from the likes table, so the counter always equals the
     * number of like rows and can never become negative.
     *
     * @param id the artwork ID
     * @return number of updated rows
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE artworks SET likes_count = " +
           "(SELECT COUNT(*) FROM likes WHERE likes.artwork_id = :id) WHERE id = :id", nativeQuery = true)
    int recomputeLikesCount(@Param("id") Long id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE artworks SET likes_count = " +
           "(SELECT COUNT(*) FROM likes WHERE likes.artwork_id = artworks.id) WHERE id IN (:ids)", nativeQuery = true)
    int recomputeLikesCounts(@Param("ids") Collection<Long> ids);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Artwork a WHERE a.artist.id = :artistId")
    int deleteByArtistId(@Param("artistId") Long artistId);
}
