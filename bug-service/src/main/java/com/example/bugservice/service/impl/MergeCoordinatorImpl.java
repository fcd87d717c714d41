package com.example.bugservice.service.impl;

import com.example.bugservice.dto.request.MergeBugsRequest;
import com.example.bugservice.dto.response.MergeResponse;
import com.example.bugservice.entity.AuditAction;
import com.example.bugservice.entity.AuditLog;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.Comment;
import com.example.bugservice.event.AuditEvent;
import com.example.bugservice.event.BugChangedEvent;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.repository.CommentRepository;
import com.example.bugservice.repository.FileAttachmentRepository;
import com.example.bugservice.repository.VoteRepository;
import com.example.bugservice.service.BugResponseAssembler;
import com.example.bugservice.service.MergeCoordinator;
import com.example.bugservice.util.InputSanitizer;
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
public class MergeCoordinatorImpl implements MergeCoordinator {

    static final String MERGE_NOTE_TEMPLATE =
            "This bug report was merged with another duplicate report. Original title: \"%s\". Reason: %s";

    private static final String AUDIT_TEMPLATE = "Merged bug '%s' (ID: %s) into '%s' (ID: %s). Reason: %s";

    private final BugReportRepository bugReportRepository;
    private final VoteRepository voteRepository;
    private final CommentRepository commentRepository;
    private final FileAttachmentRepository attachmentRepository;
    private final BugResponseAssembler assembler;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public MergeResponse merge(MergeBugsRequest request, UUID adminId) {
        UUID sourceId = request.getSourceBugId();
        UUID targetId = request.getTargetBugId();
        String reason = InputSanitizer.sanitize(request.getReason());

        if (sourceId.equals(targetId)) {
            throw BadRequestException.invalidMerge();
        }

        BugReport source = bugReportRepository.findActiveById(sourceId)
                .orElseThrow(() -> ResourceNotFoundException.sourceBugNotFound(sourceId));
        BugReport target = bugReportRepository.findActiveById(targetId)
                .orElseThrow(() -> ResourceNotFoundException.targetBugNotFound(targetId));

        String sourceTitle = source.getTitle();
        String targetTitle = target.getTitle();
        log.info("Merging bug {} into {}: reason={}", sourceId, targetId, reason);

        int copiedVotes = voteRepository.copyVotes(sourceId, targetId);
        voteRepository.deleteAllForBug(sourceId);
        int movedComments = commentRepository.reassignComments(sourceId, targetId);
        int movedAttachments = attachmentRepository.reassignAttachments(sourceId, targetId);

        // Note goes in before the recount so comment_count includes it
        commentRepository.saveAndFlush(Comment.builder()
                .bugId(targetId)
                .userId(adminId)
                .content(String.format(MERGE_NOTE_TEMPLATE, sourceTitle, reason))
                .companyResponse(false)
                .build());

        // Recounts clear the persistence context; reload afterwards
        bugReportRepository.recountEngagement(sourceId);
        bugReportRepository.recountEngagement(targetId);

        BugReport freshSource = bugReportRepository.findActiveById(sourceId)
                .orElseThrow(() -> ResourceNotFoundException.sourceBugNotFound(sourceId));
        freshSource.softDelete(Instant.now());
        bugReportRepository.saveAndFlush(freshSource);

        BugReport mergedTarget = bugReportRepository.findActiveById(targetId)
                .orElseThrow(() -> ResourceNotFoundException.targetBugNotFound(targetId));

        eventPublisher.publishEvent(new AuditEvent(
                AuditAction.BUG_MERGE,
                AuditLog.RESOURCE_BUG,
                targetId,
                String.format(AUDIT_TEMPLATE, sourceTitle, sourceId, targetTitle, targetId, reason),
                adminId));
        eventPublisher.publishEvent(BugChangedEvent.of(sourceId, targetId));

        log.info("Bugs merged: source={}, target={}, votesCopied={}, commentsMoved={}, attachmentsMoved={}, "
                        + "targetVotes={}, targetComments={}",
                sourceId, targetId, copiedVotes, movedComments, movedAttachments,
                mergedTarget.getVoteCount(), mergedTarget.getCommentCount());

        return MergeResponse.builder()
                .message("Bugs merged successfully")
                .sourceBugId(sourceId)
                .targetBugId(targetId)
                .reason(reason)
                .targetBug(assembler.toResponse(mergedTarget))
                .build();
    }
}
