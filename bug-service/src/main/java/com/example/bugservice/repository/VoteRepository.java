package com.example.bugservice.repository;

import com.example.bugservice.entity.Vote;
import com.example.bugservice.entity.VoteId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for Vote entity (composite key bug_id + user_id).
 */
@Repository
public interface VoteRepository extends JpaRepository<Vote, VoteId>, VoteRepositoryCustom {

    long countByBugId(UUID bugId);

    boolean existsByBugIdAndUserId(UUID bugId, UUID userId);

    /**
     * Atomic delete of one vote.
     * @return 1 if the vote existed, 0 otherwise
     */
    @Modifying
    @Query("DELETE FROM Vote v WHERE v.bugId = :bugId AND v.userId = :userId")
    int deleteVote(@Param("bugId") UUID bugId, @Param("userId") UUID userId);

    @Modifying
    @Query("DELETE FROM Vote v WHERE v.bugId = :bugId")
    int deleteAllForBug(@Param("bugId") UUID bugId);
}
