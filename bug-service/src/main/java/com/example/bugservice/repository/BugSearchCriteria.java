package com.example.bugservice.repository;

import com.example.bugservice.entity.BugPriority;
import com.example.bugservice.entity.BugStatus;

import java.time.Instant;
import java.util.List;

/**
 * Normalised filters for bug listing. Null fields are not applied.
 *
 * @param search        case-insensitive substring over title, description and application name
 * @param tags          every tag must be present on the bug
 * @param application   case-insensitive substring of the application name
 * @param company       case-insensitive substring of the assigned company name
 * @param createdAfter  lower bound on creation time (trending)
 */
public record BugSearchCriteria(
        String search,
        BugStatus status,
        BugPriority priority,
        List<String> tags,
        String application,
        String company,
        Instant createdAfter,
        BugSortOrder sort,
        int page,
        int limit
) {
}
