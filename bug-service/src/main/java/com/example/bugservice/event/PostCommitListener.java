package com.example.bugservice.event;

import com.example.bugservice.cache.BugCache;
import com.example.bugservice.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Best-effort side effects of committed writes: audit rows and cache eviction.
 * Failures are logged and never reach the caller, whose transaction has already committed.
 * Runs on the request thread so audit rows still see the request's IP and user agent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PostCommitListener {

    private final AuditService auditService;
    private final BugCache bugCache;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAudit(AuditEvent event) {
        try {
            auditService.record(event.action(), event.resource(), event.resourceId(),
                    event.details(), event.userId());
        } catch (Exception e) {
            log.error("Failed to write audit log {} for {}:{}",
                    event.action().getValue(), event.resource(), event.resourceId(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBugChanged(BugChangedEvent event) {
        event.bugIds().forEach(bugCache::evictBug);
        bugCache.evictLists();
    }
}
