package com.example.bugservice.repository;

import com.example.bugservice.entity.BugReport;
import org.springframework.data.domain.Page;

/**
 * Dynamic listing query for BugReport.
 */
public interface BugReportRepositoryCustom {

    /**
     * Search live bugs with the given filters, ordering and 1-based pagination.
     */
    Page<BugReport> search(BugSearchCriteria criteria);
}
