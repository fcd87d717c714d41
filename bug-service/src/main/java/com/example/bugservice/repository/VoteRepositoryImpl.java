package com.example.bugservice.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Native insert-or-ignore statements for bug_votes.
 * The (bug_id, user_id) primary key does the de-duplication; ON CONFLICT DO NOTHING
 * without a conflict target is accepted by PostgreSQL and by H2 in PostgreSQL mode.
 * Callers must already be inside a transaction.
 */
@Repository
@Slf4j
public class VoteRepositoryImpl implements VoteRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public int insertIgnoringConflict(UUID bugId, UUID userId) {
        String sql = """
                INSERT INTO bug_votes (bug_id, user_id, created_at)
                VALUES (:bugId, :userId, CURRENT_TIMESTAMP)
                ON CONFLICT DO NOTHING
                """;

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("bugId", bugId);
        query.setParameter("userId", userId);
        return query.executeUpdate();
    }

    @Override
    public int copyVotes(UUID sourceBugId, UUID targetBugId) {
        String sql = """
                INSERT INTO bug_votes (bug_id, user_id, created_at)
                SELECT :targetBugId, v.user_id, v.created_at
                FROM bug_votes v
                WHERE v.bug_id = :sourceBugId
                ON CONFLICT DO NOTHING
                """;

        Query query = entityManager.createNativeQuery(sql);
        query.setParameter("targetBugId", targetBugId);
        query.setParameter("sourceBugId", sourceBugId);
        int inserted = query.executeUpdate();

        log.debug("Copied {} votes from bug {} to bug {}", inserted, sourceBugId, targetBugId);
        return inserted;
    }
}
