package com.example.bugservice.service.impl;

import com.example.bugservice.entity.AuditAction;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.BugStatus;
import com.example.bugservice.event.AuditEvent;
import com.example.bugservice.event.BugChangedEvent;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.InternalServerException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.AuditLogRepository;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.service.AuditService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminModerationServiceImplTest {

    @Mock
    private BugReportRepository bugReportRepository;
    @Mock
    private AuditLogRepository auditLogRepository;
    @Mock
    private AuditService auditService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private AdminModerationServiceImpl moderationService;

    private final UUID bugId = UUID.randomUUID();
    private final UUID adminId = UUID.randomUUID();

    @Test
    void flagBug_auditFailure_surfacesAsAuditLogFailed() {
        // GIVEN
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug()));
        when(auditService.record(eq(AuditAction.BUG_FLAG), anyString(), eq(bugId), anyString(), eq(adminId)))
                .thenThrow(new DataAccessResourceFailureException("audit table unavailable"));

        // WHEN / THEN
        assertThatThrownBy(() -> moderationService.flagBug(bugId, "spam", adminId))
                .isInstanceOf(InternalServerException.class)
                .hasFieldOrPropertyWithValue("code", "AUDIT_LOG_FAILED");
    }

    @Test
    void flagBug_missingBug_throwsNotFound() {
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> moderationService.flagBug(bugId, "spam", adminId))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(auditService);
    }

    @Test
    void removeBug_softDeletesAndPublishesAudit() {
        // GIVEN
        BugReport bug = bug();
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug));

        // WHEN
        moderationService.removeBug(bugId, "offensive", adminId);

        // THEN
        assertThat(bug.getDeletionState().isDeleted()).isTrue();
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(events.capture());
        AuditEvent audit = (AuditEvent) events.getAllValues().get(0);
        assertThat(audit.action()).isEqualTo(AuditAction.BUG_REMOVE);
        assertThat(audit.details()).isEqualTo("Bug removed. Reason: offensive. Title: Checkout crashes");
        assertThat(events.getAllValues().get(1)).isEqualTo(BugChangedEvent.of(bugId));
    }

    @Test
    void restoreBug_liveBug_isRejected() {
        when(bugReportRepository.findByIdIncludingDeleted(bugId)).thenReturn(Optional.of(bug()));

        assertThatThrownBy(() -> moderationService.restoreBug(bugId, adminId))
                .isInstanceOf(BadRequestException.class)
                .hasFieldOrPropertyWithValue("code", "BUG_NOT_DELETED");
        verify(bugReportRepository, never()).save(any());
    }

    @Test
    void restoreBug_deletedBug_becomesVisibleAgain() {
        BugReport bug = bug();
        bug.softDelete(Instant.now());
        when(bugReportRepository.findByIdIncludingDeleted(bugId)).thenReturn(Optional.of(bug));

        moderationService.restoreBug(bugId, adminId);

        assertThat(bug.getDeletionState().isDeleted()).isFalse();
        verify(bugReportRepository).save(bug);
    }

    private BugReport bug() {
        return BugReport.builder()
                .id(bugId)
                .title("Checkout crashes")
                .description("Pressing pay throws an error")
                .status(BugStatus.OPEN)
                .build();
    }
}
