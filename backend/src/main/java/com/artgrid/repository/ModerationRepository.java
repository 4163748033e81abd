package com.artgrid.repository;

import com.artgrid.entity.Moderation;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for the moderation log.
 *
 * The log is append-only from the application's point of view; the bulk statements
 * below exist only for account deletion.
 */
@Repository
public interface ModerationRepository extends JpaRepository<Moderation, Long> {

    @EntityGraph(attributePaths = "moderator")
    List<Moderation> findByArtworkIdOrderByCreatedAtDescIdDesc(Long artworkId);

    long countByArtworkId(Long artworkId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Moderation m WHERE m.artwork.id IN :artworkIds")
    int deleteByArtworkIds(@Param("artworkIds") Collection<Long> artworkIds);

    /**
     * Keeps decisions made by a moderator whose account is being removed.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Moderation m SET m.moderator = NULL WHERE m.moderator.id = :moderatorId")
    int detachModerator(@Param("moderatorId") Long moderatorId);
}
