package com.example.bugservice.service;

import com.example.bugservice.dto.response.AuditLogListResponse;

import java.util.UUID;

/**
 * Admin moderation of bug reports and audit log browsing.
 */
public interface AdminModerationService {

    /**
     * Record a flag in the audit log. The audit row is the whole effect, so its failure fails the call.
     */
    void flagBug(UUID bugId, String reason, UUID adminId);

    void removeBug(UUID bugId, String reason, UUID adminId);

    /**
     * Clear the tombstone of a soft-deleted bug.
     */
    void restoreBug(UUID bugId, UUID adminId);

    AuditLogListResponse getAuditLogs(Integer page, Integer limit, String action, String resource, UUID userId);
}
