package com.example.bugservice.event;

import com.example.bugservice.entity.AuditAction;

import java.util.UUID;

/**
 * Audit record to write once the publishing transaction has committed.
 * Carries ids and text only, never entities.
 */
public record AuditEvent(
        AuditAction action,
        String resource,
        UUID resourceId,
        String details,
        UUID userId
) {
}
