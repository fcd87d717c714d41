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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EngagementLedgerImplTest {

    @Mock
    private BugReportRepository bugReportRepository;
    @Mock
    private VoteRepository voteRepository;
    @Mock
    private CommentRepository commentRepository;
    @Mock
    private CompanyMemberRepository memberRepository;
    @Mock
    private CompanyAccessPolicy accessPolicy;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private EngagementLedgerImpl ledger;

    private final UUID bugId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();
    private final UUID companyId = UUID.randomUUID();

    @Test
    void toggleVote_existingVote_removesAndDecrements() {
        // GIVEN
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug(null)));
        when(voteRepository.deleteVote(bugId, userId)).thenReturn(1);
        when(bugReportRepository.findVoteCount(bugId)).thenReturn(Optional.of(0));

        // WHEN
        VoteResponse response = ledger.toggleVote(bugId, userId);

        // THEN
        assertThat(response.isVoted()).isFalse();
        assertThat(response.getVoteCount()).isZero();
        verify(bugReportRepository).adjustVoteCount(bugId, -1);
        verify(voteRepository, never()).insertIgnoringConflict(any(), any());
        verify(eventPublisher).publishEvent(BugChangedEvent.of(bugId));
    }

    @Test
    void toggleVote_noVote_insertsAndIncrements() {
        // GIVEN
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug(null)));
        when(voteRepository.deleteVote(bugId, userId)).thenReturn(0);
        when(voteRepository.insertIgnoringConflict(bugId, userId)).thenReturn(1);
        when(bugReportRepository.findVoteCount(bugId)).thenReturn(Optional.of(1));

        // WHEN
        VoteResponse response = ledger.toggleVote(bugId, userId);

        // THEN
        assertThat(response.isVoted()).isTrue();
        assertThat(response.getVoteCount()).isEqualTo(1);
        verify(bugReportRepository).adjustVoteCount(bugId, 1);
    }

    @Test
    void toggleVote_concurrentInsertWon_leavesCounterAlone() {
        // GIVEN: another request inserted the same vote between our delete and insert
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug(null)));
        when(voteRepository.deleteVote(bugId, userId)).thenReturn(0);
        when(voteRepository.insertIgnoringConflict(bugId, userId)).thenReturn(0);
        when(bugReportRepository.findVoteCount(bugId)).thenReturn(Optional.of(1));

        // WHEN
        VoteResponse response = ledger.toggleVote(bugId, userId);

        // THEN
        assertThat(response.isVoted()).isTrue();
        verify(bugReportRepository, never()).adjustVoteCount(any(), anyInt());
    }

    @Test
    void toggleVote_missingBug_throwsNotFoundWithoutWrites() {
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledger.toggleVote(bugId, userId))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasFieldOrPropertyWithValue("code", "BUG_NOT_FOUND");
        verifyNoInteractions(voteRepository);
    }

    @Test
    void addComment_byCompanyMember_isCompanyResponse() {
        // GIVEN
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug(companyId)));
        when(memberRepository.existsByCompanyIdAndUserId(companyId, userId)).thenReturn(true);
        when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> inv.getArgument(0));

        // WHEN
        CommentResponse comment = ledger.addComment(bugId, userId, "Reproduced on staging");

        // THEN
        assertThat(comment.isCompanyResponse()).isTrue();
        assertThat(comment.getContent()).isEqualTo("Reproduced on staging");
        verify(bugReportRepository).adjustCommentCount(bugId, 1);
    }

    @Test
    void addComment_onUnassignedBug_isNeverCompanyResponse() {
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug(null)));
        when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> inv.getArgument(0));

        CommentResponse comment = ledger.addComment(bugId, userId, "Same here");

        assertThat(comment.isCompanyResponse()).isFalse();
        verifyNoInteractions(memberRepository);
    }

    @Test
    void addComment_invalidContent_rejectedBeforeLookup() {
        assertThatThrownBy(() -> ledger.addComment(bugId, userId, "<script>alert(1)</script>"))
                .isInstanceOf(BadRequestException.class)
                .hasFieldOrPropertyWithValue("code", "INVALID_CONTENT");
        assertThatThrownBy(() -> ledger.addComment(bugId, userId, "   "))
                .isInstanceOf(BadRequestException.class);

        verifyNoInteractions(bugReportRepository, commentRepository);
    }

    @Test
    void addCompanyResponse_outsider_isForbidden() {
        // GIVEN
        CurrentUser outsider = new CurrentUser(userId, List.of());
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug(companyId)));
        when(accessPolicy.canActForCompany(outsider, companyId)).thenReturn(false);

        // WHEN / THEN
        assertThatThrownBy(() -> ledger.addCompanyResponse(bugId, outsider, "We are on it"))
                .isInstanceOf(ForbiddenException.class)
                .hasFieldOrPropertyWithValue("code", "INSUFFICIENT_PERMISSIONS");
        verify(commentRepository, never()).save(any());
    }

    @Test
    void addCompanyResponse_permittedActor_forcesCompanyResponse() {
        CurrentUser member = new CurrentUser(userId, List.of());
        when(bugReportRepository.findActiveById(bugId)).thenReturn(Optional.of(bug(companyId)));
        when(accessPolicy.canActForCompany(member, companyId)).thenReturn(true);
        when(commentRepository.save(any(Comment.class))).thenAnswer(inv -> inv.getArgument(0));

        CommentResponse comment = ledger.addCompanyResponse(bugId, member, "Fix ships tomorrow");

        assertThat(comment.isCompanyResponse()).isTrue();
        verify(bugReportRepository).adjustCommentCount(bugId, 1);
    }

    private BugReport bug(UUID assignedCompanyId) {
        return BugReport.builder()
                .id(bugId)
                .title("Login broken")
                .assignedCompanyId(assignedCompanyId)
                .build();
    }
}
