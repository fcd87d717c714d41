package com.example.bugservice.event;

import java.util.List;
import java.util.UUID;

/**
 * Published inside a write transaction. After commit the cached entries of these bugs
 * and every cached list page are evicted. An empty id list evicts list pages only.
 */
public record BugChangedEvent(List<UUID> bugIds) {

    public static BugChangedEvent of(UUID... bugIds) {
        return new BugChangedEvent(List.of(bugIds));
    }

    public static BugChangedEvent listsOnly() {
        return new BugChangedEvent(List.of());
    }
}
