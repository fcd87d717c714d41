package com.example.bugservice.repository;

import java.util.UUID;

/**
 * Custom repository interface for conflict-tolerant vote inserts.
 */
public interface VoteRepositoryCustom {

    /**
     * Insert a vote, doing nothing if the (bug, user) pair already exists.
     *
     * @return 1 if a row was inserted, 0 if it already existed
     */
    int insertIgnoringConflict(UUID bugId, UUID userId);

    /**
     * Copy every vote of the source bug onto the target bug, skipping users
     * that already voted on the target. Source rows are left in place.
     *
     * @return number of rows inserted for the target
     */
    int copyVotes(UUID sourceBugId, UUID targetBugId);
}
