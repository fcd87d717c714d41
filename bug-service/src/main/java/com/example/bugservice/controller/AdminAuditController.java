package com.example.bugservice.controller;

import com.example.bugservice.dto.response.AuditLogListResponse;
import com.example.bugservice.service.AdminModerationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/admin/audit-logs")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminAuditController {

    private final AdminModerationService moderationService;

    /**
     * Newest first.
     */
    @GetMapping
    public ResponseEntity<AuditLogListResponse> getAuditLogs(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String resource,
            @RequestParam(name = "user_id", required = false) UUID userId) {

        return ResponseEntity.ok(moderationService.getAuditLogs(page, limit, action, resource, userId));
    }
}
