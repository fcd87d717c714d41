package com.example.bugservice.controller;

import com.example.bugservice.dto.request.AddCommentRequest;
import com.example.bugservice.dto.request.BugListQuery;
import com.example.bugservice.dto.request.CreateBugRequest;
import com.example.bugservice.dto.request.UpdateStatusRequest;
import com.example.bugservice.dto.response.*;
import com.example.bugservice.exception.UnauthorizedException;
import com.example.bugservice.security.CurrentUser;
import com.example.bugservice.service.BugService;
import com.example.bugservice.service.EngagementLedger;
import com.example.bugservice.service.StatusWorkflow;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST Controller for bug reports.
 *
 * Authorization:
 * - GET /bugs, GET /bugs/{id}: PUBLIC
 * - POST /bugs: PUBLIC (anonymous submissions allowed)
 * - POST /bugs/{id}/vote, POST /bugs/{id}/comments: AUTHENTICATED
 * - PATCH /bugs/{id}/status, POST /bugs/{id}/company-response: company member or ADMIN
 */
@RestController
@RequestMapping("/bugs")
@RequiredArgsConstructor
@Slf4j
public class BugController {

    private final BugService bugService;
    private final EngagementLedger engagementLedger;
    private final StatusWorkflow statusWorkflow;

    @PostMapping
    public ResponseEntity<BugMessageResponse> createBug(
            @RequestBody CreateBugRequest request,
            @AuthenticationPrincipal CurrentUser user) {

        UUID reporterId = user != null ? user.getUserId() : null;
        BugResponse bug = bugService.createBug(request, reporterId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new BugMessageResponse("Bug report created successfully", bug));
    }

    @GetMapping
    public ResponseEntity<BugListResponse> listBugs(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String priority,
            @RequestParam(required = false) String tags,
            @RequestParam(required = false) String application,
            @RequestParam(required = false) String company,
            @RequestParam(required = false) String sort) {

        BugListQuery query = BugListQuery.builder()
                .page(page)
                .limit(limit)
                .search(search)
                .status(status)
                .priority(priority)
                .tags(tags)
                .application(application)
                .company(company)
                .sort(sort)
                .build();
        return ResponseEntity.ok(bugService.listBugs(query));
    }

    @GetMapping("/{bugId}")
    public ResponseEntity<BugDetailResponse> getBug(@PathVariable UUID bugId) {
        return ResponseEntity.ok(new BugDetailResponse(bugService.getBug(bugId)));
    }

    /**
     * Toggle the caller's vote: 201 when added, 200 when removed.
     */
    @PostMapping("/{bugId}/vote")
    public ResponseEntity<VoteResponse> toggleVote(
            @PathVariable UUID bugId,
            @AuthenticationPrincipal CurrentUser user) {

        VoteResponse response = engagementLedger.toggleVote(bugId, requireUser(user).getUserId());
        HttpStatus status = response.isVoted() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/{bugId}/comments")
    public ResponseEntity<CommentMessageResponse> addComment(
            @PathVariable UUID bugId,
            @RequestBody AddCommentRequest request,
            @AuthenticationPrincipal CurrentUser user) {

        CommentResponse comment = engagementLedger.addComment(bugId, requireUser(user).getUserId(),
                request.getContent());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CommentMessageResponse("Comment added successfully", comment));
    }

    @PatchMapping("/{bugId}/status")
    public ResponseEntity<BugMessageResponse> updateStatus(
            @PathVariable UUID bugId,
            @Valid @RequestBody UpdateStatusRequest request,
            @AuthenticationPrincipal CurrentUser user) {

        BugResponse bug = statusWorkflow.updateStatus(bugId, request.getStatus(), requireUser(user));
        return ResponseEntity.ok(new BugMessageResponse("Bug status updated successfully", bug));
    }

    @PostMapping("/{bugId}/company-response")
    public ResponseEntity<CommentMessageResponse> addCompanyResponse(
            @PathVariable UUID bugId,
            @RequestBody AddCommentRequest request,
            @AuthenticationPrincipal CurrentUser user) {

        CommentResponse comment = engagementLedger.addCompanyResponse(bugId, requireUser(user),
                request.getContent());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CommentMessageResponse("Company response added successfully", comment));
    }

    private static CurrentUser requireUser(CurrentUser user) {
        if (user == null) {
            throw UnauthorizedException.authenticationRequired();
        }
        return user;
    }
}
