package com.example.bugservice.cache;

import com.example.bugservice.dto.response.BugListResponse;
import com.example.bugservice.dto.response.BugResponse;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-through cache for bug reads.
 *
 * Writes never update entries, they only evict them.
 * Implementations must not throw: failures degrade to a miss or a no-op.
 */
public interface BugCache {

    Optional<BugResponse> getBug(UUID bugId);

    void putBug(UUID bugId, BugResponse bug);

    Optional<BugListResponse> getList(String listKey);

    void putList(String listKey, BugListResponse list);

    void evictBug(UUID bugId);

    /**
     * Drop every cached list page.
     */
    void evictLists();
}
