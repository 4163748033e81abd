package com.artgrid.repository;

import com.artgrid.entity.Comment;
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

/**
 * Repository interface for comments.
 */
@Repository
public interface CommentRepository extends JpaRepository<Comment, Long> {

    /**
     * Public comment listing of an artwork, newest first, flagged comments excluded.
     *
     * @param artworkId the artwork ID
     * @return visible comments with their authors loaded
     */
    @EntityGraph(attributePaths = "user")
    List<Comment> findByArtworkIdAndFlaggedFalseOrderByCreatedAtDescIdDesc(Long artworkId);

    @EntityGraph(attributePaths = {"user", "artwork"})
    Page<Comment> findByFlaggedTrueOrderByCreatedAtDescIdDesc(Pageable pageable);

    long countByFlaggedTrue();

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Comment c WHERE c.user.id = :userId")
    int deleteByUserId(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Comment c WHERE c.artwork.id IN :artworkIds")
    int deleteByArtworkIds(@Param("artworkIds") Collection<Long> artworkIds);
}
