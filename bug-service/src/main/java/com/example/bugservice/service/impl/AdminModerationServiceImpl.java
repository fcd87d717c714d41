package com.example.bugservice.service.impl;

import com.example.bugservice.dto.response.AuditLogListResponse;
import com.example.bugservice.dto.response.AuditLogResponse;
import com.example.bugservice.dto.response.PaginationResponse;
import com.example.bugservice.entity.AuditAction;
import com.example.bugservice.entity.AuditLog;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.event.AuditEvent;
import com.example.bugservice.event.BugChangedEvent;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.InternalServerException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.AuditLogRepository;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.service.AdminModerationService;
import com.example.bugservice.service.AuditService;
import com.example.bugservice.util.InputSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AdminModerationServiceImpl implements AdminModerationService {

    private static final int DEFAULT_AUDIT_PAGE_SIZE = 50;
    private static final int MAX_AUDIT_PAGE_SIZE = 100;

    private final BugReportRepository bugReportRepository;
    private final AuditLogRepository auditLogRepository;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void flagBug(UUID bugId, String reason, UUID adminId) {
        bugReportRepository.findActiveById(bugId)
                .orElseThrow(() -> ResourceNotFoundException.bugNotFound(bugId));

        try {
            auditService.record(AuditAction.BUG_FLAG, AuditLog.RESOURCE_BUG, bugId,
                    String.format("Bug flagged for review. Reason: %s", InputSanitizer.sanitize(reason)),
                    adminId);
        } catch (RuntimeException e) {
            log.error("Failed to record bug flag: bugId={}", bugId, e);
            throw InternalServerException.auditLogFailed(e);
        }
        log.info("Bug flagged: bugId={}, by={}", bugId, adminId);
    }

    @Override
    @Transactional
    public void removeBug(UUID bugId, String reason, UUID adminId) {
        BugReport bug = bugReportRepository.findActiveById(bugId)
                .orElseThrow(() -> ResourceNotFoundException.bugNotFound(bugId));

        bug.softDelete(Instant.now());
        bugReportRepository.save(bug);

        eventPublisher.publishEvent(new AuditEvent(
                AuditAction.BUG_REMOVE,
                AuditLog.RESOURCE_BUG,
                bugId,
                String.format("Bug removed. Reason: %s. Title: %s", InputSanitizer.sanitize(reason), bug.getTitle()),
                adminId));
        eventPublisher.publishEvent(BugChangedEvent.of(bugId));

        log.info("Bug removed: bugId={}, by={}", bugId, adminId);
    }

    @Override
    @Transactional
    public void restoreBug(UUID bugId, UUID adminId) {
        BugReport bug = bugReportRepository.findByIdIncludingDeleted(bugId)
                .orElseThrow(() -> ResourceNotFoundException.bugNotFound(bugId));

        if (!bug.getDeletionState().isDeleted()) {
            throw BadRequestException.bugNotDeleted();
        }

        bug.restore();
        bugReportRepository.save(bug);

        eventPublisher.publishEvent(new AuditEvent(
                AuditAction.BUG_RESTORE,
                AuditLog.RESOURCE_BUG,
                bugId,
                String.format("Bug restored. Title: %s", bug.getTitle()),
                adminId));
        eventPublisher.publishEvent(BugChangedEvent.of(bugId));

        log.info("Bug restored: bugId={}, by={}", bugId, adminId);
    }

    @Override
    @Transactional(readOnly = true)
    public AuditLogListResponse getAuditLogs(Integer page, Integer limit, String action, String resource, UUID userId) {
        int pageNumber = page == null || page <= 0 ? 1 : page;
        int pageSize = limit == null || limit <= 0 || limit > MAX_AUDIT_PAGE_SIZE ? DEFAULT_AUDIT_PAGE_SIZE : limit;

        Page<AuditLog> logs = auditLogRepository.findByFilters(
                emptyToNull(action), emptyToNull(resource), userId, PageRequest.of(pageNumber - 1, pageSize));

        return new AuditLogListResponse(
                logs.getContent().stream().map(AuditLogResponse::from).toList(),
                PaginationResponse.of(pageNumber, pageSize, logs.getTotalElements()));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
