package com.example.bugservice.repository;

import com.example.bugservice.entity.BugReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for BugReport entity.
 * Note: @SQLRestriction on BugReport filters soft-deleted rows from entity loads;
 * queries below still state deletedAt IS NULL explicitly.
 *
 * Counter columns are only changed through the UPDATE statements here,
 * never by read-modify-write on a loaded entity.
 */
@Repository
public interface BugReportRepository extends JpaRepository<BugReport, UUID>, BugReportRepositoryCustom {

    @Query("SELECT b FROM BugReport b WHERE b.id = :id AND b.deletedAt IS NULL")
    Optional<BugReport> findActiveById(@Param("id") UUID id);

    /**
     * Load a bug regardless of its tombstone. Native SQL bypasses @SQLRestriction.
     */
    @Query(value = "SELECT * FROM bug_reports WHERE id = :id", nativeQuery = true)
    Optional<BugReport> findByIdIncludingDeleted(@Param("id") UUID id);

    @Query("SELECT b.voteCount FROM BugReport b WHERE b.id = :id")
    Optional<Integer> findVoteCount(@Param("id") UUID id);

    @Modifying
    @Query("UPDATE BugReport b SET b.voteCount = b.voteCount + :delta WHERE b.id = :id")
    int adjustVoteCount(@Param("id") UUID id, @Param("delta") int delta);

    @Modifying
    @Query("UPDATE BugReport b SET b.commentCount = b.commentCount + :delta WHERE b.id = :id")
    int adjustCommentCount(@Param("id") UUID id, @Param("delta") int delta);

    /**
     * Recompute both counters from the live rows.
     */
    @Modifying(clearAutomatically = true)
    @Query(value = """
            UPDATE bug_reports
            SET vote_count = (SELECT COUNT(*) FROM bug_votes v WHERE v.bug_id = :id),
                comment_count = (SELECT COUNT(*) FROM comments c WHERE c.bug_id = :id)
            WHERE id = :id
            """, nativeQuery = true)
    int recountEngagement(@Param("id") UUID id);

    /**
     * Assign unassigned live bugs of the company's applications to the company.
     */
    @Modifying
    @Query("UPDATE BugReport b SET b.assignedCompanyId = :companyId " +
           "WHERE b.assignedCompanyId IS NULL AND b.deletedAt IS NULL " +
           "AND b.applicationId IN (SELECT a.id FROM Application a WHERE a.companyId = :companyId)")
    int assignUnassignedBugsToCompany(@Param("companyId") UUID companyId);
}
