package com.example.bugservice.service.impl;

import com.example.bugservice.dto.response.CommentResponse;
import com.example.bugservice.dto.response.VoteResponse;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.Comment;
import com.example.bugservice.event.BugChangedEvent;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.ForbiddenException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.repository.CommentRepository;
import com.example.bugservice.repository.CompanyMemberRepository;
import com.example.bugservice.repository.VoteRepository;
import com.example.bugservice.security.CurrentUser;
import com.example.bugservice.service.CompanyAccessPolicy;
import com.example.bugservice.service.EngagementLedger;
import com.example.bugservice.util.InputSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Counter changes follow affected-row counts only: a delete that removed nothing
 * or an insert that hit an existing row leaves the counter alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngagementLedgerImpl implements EngagementLedger {

    private static final int MAX_COMMENT_LENGTH = 2000;

    private final BugReportRepository bugReportRepository;
    private final VoteRepository voteRepository;
    private final CommentRepository commentRepository;
    private final CompanyMemberRepository memberRepository;
    private final CompanyAccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public VoteResponse toggleVote(UUID bugId, UUID userId) {
        requireLiveBug(bugId);

        boolean voted;
        if (voteRepository.deleteVote(bugId, userId) == 1) {
            bugReportRepository.adjustVoteCount(bugId, -1);
            voted = false;
        } else {
            if (voteRepository.insertIgnoringConflict(bugId, userId) == 1) {
                bugReportRepository.adjustVoteCount(bugId, 1);
            } else {
                log.debug("Concurrent vote already recorded: bugId={}, userId={}", bugId, userId);
            }
            voted = true;
        }

        int voteCount = bugReportRepository.findVoteCount(bugId).orElse(0);
        eventPublisher.publishEvent(BugChangedEvent.of(bugId));

        log.info("Vote toggled: bugId={}, userId={}, voted={}, voteCount={}", bugId, userId, voted, voteCount);
        return VoteResponse.builder()
                .message(voted ? "Vote added successfully" : "Vote removed successfully")
                .voted(voted)
                .voteCount(voteCount)
                .build();
    }

    @Override
    @Transactional
    public CommentResponse addComment(UUID bugId, UUID userId, String content) {
        String sanitized = validateContent(content);
        BugReport bug = requireLiveBug(bugId);

        boolean companyResponse = bug.getAssignedCompanyId() != null
                && memberRepository.existsByCompanyIdAndUserId(bug.getAssignedCompanyId(), userId);

        return saveComment(bugId, userId, sanitized, companyResponse);
    }

    @Override
    @Transactional
    public CommentResponse addCompanyResponse(UUID bugId, CurrentUser actor, String content) {
        String sanitized = validateContent(content);
        BugReport bug = requireLiveBug(bugId);

        if (!accessPolicy.canActForCompany(actor, bug.getAssignedCompanyId())) {
            log.warn("Company response denied: bugId={}, userId={}", bugId, actor.getUserId());
            throw ForbiddenException.notCompanyMember();
        }

        return saveComment(bugId, actor.getUserId(), sanitized, true);
    }

    private CommentResponse saveComment(UUID bugId, UUID userId, String content, boolean companyResponse) {
        Comment comment = commentRepository.save(Comment.builder()
                .bugId(bugId)
                .userId(userId)
                .content(content)
                .companyResponse(companyResponse)
                .build());
        bugReportRepository.adjustCommentCount(bugId, 1);
        eventPublisher.publishEvent(BugChangedEvent.of(bugId));

        log.info("Comment added: bugId={}, commentId={}, companyResponse={}",
                bugId, comment.getId(), companyResponse);
        return CommentResponse.from(comment);
    }

    private BugReport requireLiveBug(UUID bugId) {
        return bugReportRepository.findActiveById(bugId)
                .orElseThrow(() -> ResourceNotFoundException.bugNotFound(bugId));
    }

    private static String validateContent(String content) {
        return InputSanitizer.validateString(content, 1, MAX_COMMENT_LENGTH)
                .orElseThrow(BadRequestException::invalidContent);
    }
}
