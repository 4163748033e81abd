package com.artgrid.repository;

import com.artgrid.entity.ArtworkLike;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for likes.
 */
@Repository
public interface ArtworkLikeRepository extends JpaRepository<ArtworkLike, Long> {

    long countByArtworkId(Long artworkId);

    /**
     * Removes the like of a user on an artwork.
     *
     * @return 1 if a like was removed, 0 if there was none
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ArtworkLike l WHERE l.user.id = :userId AND l.artwork.id = :artworkId")
    int deleteByUserIdAndArtworkId(@Param("userId") Long userId, @Param("artworkId") Long artworkId);

    @Query("SELECT DISTINCT l.artwork.id FROM ArtworkLike l WHERE l.user.id = :userId")
    List<Long> findLikedArtworkIds(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ArtworkLike l WHERE l.user.id = :userId")
    int deleteByUserId(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ArtworkLike l WHERE l.artwork.id IN :artworkIds")
    int deleteByArtworkIds(@Param("artworkIds") Collection<Long> artworkIds);
}
