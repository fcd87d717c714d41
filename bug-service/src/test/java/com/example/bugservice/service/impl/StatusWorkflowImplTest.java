package com.example.bugservice.service.impl;

import com.example.bugservice.dto.response.BugResponse;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.BugStatus;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.ForbiddenException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.security.CurrentUser;
import com.example.bugservice.service.BugResponseAssembler;
import com.example.bugservice.service.CompanyAccessPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatusWorkflowImplTest {

    @Mock
    private BugReportRepository bugReportRepository;
    @Mock
    private CompanyAccessPolicy accessPolicy;
    @Mock
    private BugResponseAssembler assembler;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private StatusWorkflowImpl workflow;

    private final UUID bugId = UUID.randomUUID();
    private final UUID companyId = UUID.randomUUID();
    private final CurrentUser admin = new CurrentUser(UUID.randomUUID(),
            List.of(new SimpleGrantedAuthority("ROLE_ADMIN")));

    @Test
    void updateStatus_unknownStatus_rejectedBeforeLookup() {
        assertThatThrownBy(() -> workflow.updateStatus(bugId, "closed", admin))
                .isInstanceOf(BadRequestException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_STATUS");

        verifyNoInteractions(bugReportRepository);
    }

    @Test
    void updateStatus_missingBug_throwsNotFound() {
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> workflow.updateStatus(bugId, "fixed", admin))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasFieldOrPropertyWithValue("code", "BUG_NOT_FOUND");
    }

    @Test
    void updateStatus_outsider_isForbiddenAndNothingSaved() {
        // GIVEN
        CurrentUser outsider = new CurrentUser(UUID.randomUUID(), List.of());
        BugReport bug = openBug();
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug));
        when(accessPolicy.canActForCompany(outsider, companyId)).thenReturn(false);

        // WHEN / THEN
        assertThatThrownBy(() -> workflow.updateStatus(bugId, "fixed", outsider))
                .isInstanceOf(ForbiddenException.class)
                .hasFieldOrPropertyWithValue("code", "INSUFFICIENT_PERMISSIONS");
        assertThat(bug.getStatus()).isEqualTo(BugStatus.OPEN);
        verify(bugReportRepository, never()).save(any());
    }

    @Test
    void updateStatus_toFixed_setsResolvedAtAndLeavesCounters() {
        // GIVEN
        BugReport bug = openBug();
        bug.setVoteCount(7);
        bug.setCommentCount(2);
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug));
        when(accessPolicy.canActForCompany(admin, companyId)).thenReturn(true);
        when(bugReportRepository.save(bug)).thenReturn(bug);
        when(assembler.toResponse(bug)).thenReturn(BugResponse.builder().id(bugId).status("fixed").build());

        // WHEN
        BugResponse response = workflow.updateStatus(bugId, "fixed", admin);

        // THEN
        assertThat(response.getStatus()).isEqualTo("fixed");
        assertThat(bug.getStatus()).isEqualTo(BugStatus.FIXED);
        assertThat(bug.getResolvedAt()).isNotNull();
        assertThat(bug.getVoteCount()).isEqualTo(7);
        assertThat(bug.getCommentCount()).isEqualTo(2);
    }

    @Test
    void updateStatus_reopen_clearsResolvedAt() {
        BugReport bug = openBug();
        bug.transitionTo(BugStatus.WONT_FIX, Instant.parse("2026-01-01T00:00:00Z"));
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug));
        when(accessPolicy.canActForCompany(admin, companyId)).thenReturn(true);
        when(bugReportRepository.save(bug)).thenReturn(bug);

        workflow.updateStatus(bugId, "reviewing", admin);

        assertThat(bug.getStatus()).isEqualTo(BugStatus.REVIEWING);
        assertThat(bug.getResolvedAt()).isNull();
    }

    private BugReport openBug() {
        return BugReport.builder()
                .id(bugId)
                .title("Checkout crashes")
                .status(BugStatus.OPEN)
                .assignedCompanyId(companyId)
                .build();
    }
}
