package com.example.bugservice.service.impl;

import com.example.bugservice.dto.response.BugResponse;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.BugStatus;
import com.example.bugservice.event.BugChangedEvent;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.ForbiddenException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.security.CurrentUser;
import com.example.bugservice.service.BugResponseAssembler;
import com.example.bugservice.service.CompanyAccessPolicy;
import com.example.bugservice.service.StatusWorkflow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatusWorkflowImpl implements StatusWorkflow {

    private final BugReportRepository bugReportRepository;
    private final CompanyAccessPolicy accessPolicy;
    private final BugResponseAssembler assembler;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public BugResponse updateStatus(UUID bugId, String status, CurrentUser actor) {
        BugStatus newStatus = BugStatus.fromValue(status)
                .orElseThrow(() -> BadRequestException.invalidStatus(status));

        BugReport bug = bugReportRepository.findActiveById(bugId)
                .orElseThrow(() -> ResourceNotFoundException.bugNotFound(bugId));

        if (!accessPolicy.canActForCompany(actor, bug.getAssignedCompanyId())) {
            log.warn("Status update denied: bugId={}, userId={}", bugId, actor.getUserId());
            throw ForbiddenException.notCompanyMember();
        }

        BugStatus oldStatus = bug.getStatus();
        bug.transitionTo(newStatus, Instant.now());
        BugReport saved = bugReportRepository.save(bug);
        eventPublisher.publishEvent(BugChangedEvent.of(bugId));

        log.info("Bug status updated: bugId={}, {} -> {}, by={}",
                bugId, oldStatus.getValue(), newStatus.getValue(), actor.getUserId());
        return assembler.toResponse(saved);
    }
}
