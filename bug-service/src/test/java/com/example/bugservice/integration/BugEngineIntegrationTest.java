package com.example.bugservice.integration;

import com.example.bugservice.dto.request.MergeBugsRequest;
import com.example.bugservice.dto.response.BugResponse;
import com.example.bugservice.dto.response.CommentResponse;
import com.example.bugservice.dto.response.MergeResponse;
import com.example.bugservice.dto.response.VoteResponse;
import com.example.bugservice.entity.AuditLog;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.CompanyMember;
import com.example.bugservice.entity.CompanyRole;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.AuditLogRepository;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.repository.CompanyMemberRepository;
import com.example.bugservice.service.AdminModerationService;
import com.example.bugservice.service.EngagementLedger;
import com.example.bugservice.service.MergeCoordinator;
import com.example.bugservice.service.StatusWorkflow;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BugEngineIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private EngagementLedger engagementLedger;
    @Autowired
    private StatusWorkflow statusWorkflow;
    @Autowired
    private MergeCoordinator mergeCoordinator;
    @Autowired
    private AdminModerationService moderationService;
    @Autowired
    private BugReportRepository bugReportRepository;
    @Autowired
    private CompanyMemberRepository memberRepository;
    @Autowired
    private AuditLogRepository auditLogRepository;

    @Test
    void submitBug_createsPlaceholderCompanyForUnknownApplication() {
        BugResponse bug = submitBug("Login broken", "Acme App");

        assertThat(bug.getApplication().getName()).isEqualTo("Acme App");
        assertThat(bug.getCompany()).isNotNull();
        assertThat(bug.getCompany().getDomain()).isEqualTo("acme-app.app");
        assertThat(bug.getCompany().isVerified()).isFalse();
        assertThat(bug.getApplication().getCompanyId()).isEqualTo(bug.getCompany().getId());
    }

    @Test
    void submitBug_sameApplicationNameIgnoringCase_reusesApplication() {
        BugResponse first = submitBug("Login broken", "Acme App");
        BugResponse second = submitBug("Signup broken", "acme app");

        assertThat(second.getApplication().getId()).isEqualTo(first.getApplication().getId());
        assertThat(second.getCompany().getId()).isEqualTo(first.getCompany().getId());
    }

    @Test
    void toggleVote_secondToggleRemovesVoteAndCounterMatchesRows() {
        // GIVEN
        UUID bugId = submitBug("Login broken", "Acme App").getId();
        UUID voter = UUID.randomUUID();

        // WHEN
        VoteResponse added = engagementLedger.toggleVote(bugId, voter);
        VoteResponse removed = engagementLedger.toggleVote(bugId, voter);

        // THEN
        assertThat(added.isVoted()).isTrue();
        assertThat(added.getVoteCount()).isEqualTo(1);
        assertThat(removed.isVoted()).isFalse();
        assertThat(removed.getVoteCount()).isZero();
        assertThat(countRows("bug_votes", bugId)).isZero();
        assertThat(bugReportRepository.findVoteCount(bugId)).contains(0);
    }

    @Test
    void addComment_flagsCompanyMembersOnly() {
        // GIVEN
        BugResponse bug = submitBug("Login broken", "Acme App");
        UUID member = UUID.randomUUID();
        memberRepository.save(CompanyMember.builder()
                .companyId(bug.getCompany().getId())
                .userId(member)
                .role(CompanyRole.MEMBER)
                .build());

        // WHEN
        CommentResponse fromMember = engagementLedger.addComment(bug.getId(), member, "Looking into it");
        CommentResponse fromOutsider = engagementLedger.addComment(bug.getId(), UUID.randomUUID(), "Same here");

        // THEN
        assertThat(fromMember.isCompanyResponse()).isTrue();
        assertThat(fromOutsider.isCompanyResponse()).isFalse();
        assertThat(bugService.getBug(bug.getId()).getCommentCount()).isEqualTo(2);
        assertThat(countRows("comments", bug.getId())).isEqualTo(2);
    }

    @Test
    void updateStatus_resolvedAtFollowsStatus() {
        UUID bugId = submitBug("Login broken", "Acme App").getId();

        BugResponse fixed = statusWorkflow.updateStatus(bugId, "fixed", admin());
        assertThat(fixed.getStatus()).isEqualTo("fixed");
        assertThat(fixed.getResolvedAt()).isNotNull();

        BugResponse reopened = statusWorkflow.updateStatus(bugId, "open", admin());
        assertThat(reopened.getStatus()).isEqualTo("open");
        assertThat(reopened.getResolvedAt()).isNull();
    }

    @Test
    void merge_deduplicatesVotesAndMovesComments() {
        // GIVEN
        UUID sourceId = submitBug("Login button dead", "Acme App").getId();
        UUID targetId = submitBug("Login broken", "Acme App").getId();
        UUID overlapping = UUID.randomUUID();

        engagementLedger.toggleVote(sourceId, overlapping);
        engagementLedger.toggleVote(sourceId, UUID.randomUUID());
        engagementLedger.addComment(sourceId, UUID.randomUUID(), "Happens on Firefox too");

        engagementLedger.toggleVote(targetId, overlapping);
        engagementLedger.toggleVote(targetId, UUID.randomUUID());
        engagementLedger.toggleVote(targetId, UUID.randomUUID());
        engagementLedger.addComment(targetId, UUID.randomUUID(), "Confirmed");
        engagementLedger.addComment(targetId, UUID.randomUUID(), "Still broken");

        UUID adminId = UUID.randomUUID();

        // WHEN
        MergeResponse response = mergeCoordinator.merge(
                new MergeBugsRequest(sourceId, targetId, "Duplicate report"), adminId);

        // THEN
        assertThat(response.getTargetBug().getVoteCount()).isEqualTo(4);
        assertThat(response.getTargetBug().getCommentCount()).isEqualTo(4);
        assertThat(countRows("bug_votes", targetId)).isEqualTo(4);
        assertThat(countRows("comments", targetId)).isEqualTo(4);
        assertThat(countRows("bug_votes", sourceId)).isZero();
        assertThat(countRows("comments", sourceId)).isZero();

        BugReport source = bugReportRepository.findByIdIncludingDeleted(sourceId).orElseThrow();
        assertThat(source.getDeletionState().isDeleted()).isTrue();
        assertThatThrownBy(() -> bugService.getBug(sourceId))
                .isInstanceOf(ResourceNotFoundException.class);

        List<AuditLog> audit = auditLogRepository.findByResourceIdOrderByCreatedAtDesc(targetId);
        assertThat(audit).hasSize(1);
        assertThat(audit.get(0).getAction()).isEqualTo("bug_merge");
        assertThat(audit.get(0).getUserId()).isEqualTo(adminId);
    }

    @Test
    void merge_reasonThatGrowsWhenEscaped_isStoredInFull() {
        // GIVEN
        UUID sourceId = submitBug("Login button dead", "Acme App").getId();
        UUID targetId = submitBug("Login broken", "Acme App").getId();
        String reason = "\"".repeat(400);

        // WHEN
        MergeResponse response = mergeCoordinator.merge(new MergeBugsRequest(sourceId, targetId, reason),
                UUID.randomUUID());

        // THEN
        assertThat(response.getTargetBug().getCommentCount()).isEqualTo(1);
        String note = jdbcTemplate.queryForObject(
                "SELECT content FROM comments WHERE bug_id = ?", String.class, targetId);
        assertThat(note).endsWith("Reason: " + "&quot;".repeat(400));
        assertThat(note.length()).isGreaterThan(2000);
    }

    @Test
    void merge_intoDeletedTarget_changesNothing() {
        // GIVEN
        UUID sourceId = submitBug("Login button dead", "Acme App").getId();
        UUID targetId = submitBug("Login broken", "Acme App").getId();
        engagementLedger.toggleVote(sourceId, UUID.randomUUID());
        moderationService.removeBug(targetId, "spam", UUID.randomUUID());

        // WHEN / THEN
        assertThatThrownBy(() -> mergeCoordinator.merge(
                new MergeBugsRequest(sourceId, targetId, "dup"), UUID.randomUUID()))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(countRows("bug_votes", sourceId)).isEqualTo(1);
        assertThat(bugService.getBug(sourceId).getVoteCount()).isEqualTo(1);
    }

    @Test
    void removeAndRestore_roundTripsVisibility() {
        UUID bugId = submitBug("Login broken", "Acme App").getId();
        UUID adminId = UUID.randomUUID();

        moderationService.removeBug(bugId, "spam", adminId);
        assertThatThrownBy(() -> bugService.getBug(bugId)).isInstanceOf(ResourceNotFoundException.class);

        moderationService.restoreBug(bugId, adminId);
        assertThat(bugService.getBug(bugId).getTitle()).isEqualTo("Login broken");

        assertThatThrownBy(() -> moderationService.restoreBug(bugId, adminId))
                .isInstanceOf(BadRequestException.class)
                .hasFieldOrPropertyWithValue("code", "BUG_NOT_DELETED");
        assertThat(auditLogRepository.findByResourceIdOrderByCreatedAtDesc(bugId))
                .extracting(AuditLog::getAction)
                .containsExactlyInAnyOrder("bug_remove", "bug_restore");
    }
}
