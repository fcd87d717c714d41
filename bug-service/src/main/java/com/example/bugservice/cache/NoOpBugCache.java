package com.example.bugservice.cache;

import com.example.bugservice.dto.response.BugListResponse;
import com.example.bugservice.dto.response.BugResponse;

import java.util.Optional;
import java.util.UUID;

/**
 * Cache used when caching is disabled: always a miss.
 */
public class NoOpBugCache implements BugCache {

    @Override
    public Optional<BugResponse> getBug(UUID bugId) {
        return Optional.empty();
    }

    @Override
    public void putBug(UUID bugId, BugResponse bug) {
    }

    @Override
    public Optional<BugListResponse> getList(String listKey) {
        return Optional.empty();
    }

    @Override
    public void putList(String listKey, BugListResponse list) {
    }

    @Override
    public void evictBug(UUID bugId) {
    }

    @Override
    public void evictLists() {
    }
}
