package com.example.bugservice.integration;

import com.example.bugservice.dto.request.CreateBugRequest;
import com.example.bugservice.dto.response.BugResponse;
import com.example.bugservice.security.CurrentUser;
import com.example.bugservice.service.BugService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.UUID;

/**
 * Shared setup for tests running against the in-memory database.
 * Tests are not transactional so post-commit listeners run as in production.
 */
@SpringBootTest
@ActiveProfiles("test")
abstract class IntegrationTestSupport {

    private static final List<String> TABLES = List.of(
            "bug_report_tags", "bug_votes", "comments", "file_attachments", "bug_reports",
            "applications", "company_members", "companies", "audit_logs");

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected BugService bugService;

    @BeforeEach
    void cleanDatabase() {
        TABLES.forEach(table -> jdbcTemplate.update("DELETE FROM " + table));
    }

    protected BugResponse submitBug(String title, String applicationName) {
        return bugService.createBug(CreateBugRequest.builder()
                .title(title)
                .description("Steps to reproduce are in the attached notes")
                .applicationName(applicationName)
                .build(), null);
    }

    protected static CurrentUser admin() {
        return new CurrentUser(UUID.randomUUID(), List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));
    }

    protected int countRows(String table, UUID bugId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + table + " WHERE bug_id = ?", Integer.class, bugId);
        return count == null ? 0 : count;
    }
}
