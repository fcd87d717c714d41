package com.example.bugservice.controller;

import com.example.bugservice.dto.request.MergeBugsRequest;
import com.example.bugservice.dto.request.ReasonRequest;
import com.example.bugservice.dto.response.MergeResponse;
import com.example.bugservice.dto.response.MessageResponse;
import com.example.bugservice.security.CurrentUser;
import com.example.bugservice.service.AdminModerationService;
import com.example.bugservice.service.MergeCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Admin moderation of bug reports. ADMIN only.
 */
@RestController
@RequestMapping("/admin/bugs")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminBugController {

    private final MergeCoordinator mergeCoordinator;
    private final AdminModerationService moderationService;

    @PostMapping("/merge")
    public ResponseEntity<MergeResponse> mergeBugs(
            @Valid @RequestBody MergeBugsRequest request,
            @AuthenticationPrincipal CurrentUser admin) {

        return ResponseEntity.ok(mergeCoordinator.merge(request, admin.getUserId()));
    }

    @PostMapping("/{bugId}/flag")
    public ResponseEntity<MessageResponse> flagBug(
            @PathVariable UUID bugId,
            @Valid @RequestBody ReasonRequest request,
            @AuthenticationPrincipal CurrentUser admin) {

        moderationService.flagBug(bugId, request.getReason(), admin.getUserId());
        return ResponseEntity.ok(new MessageResponse("Bug flagged for review"));
    }

    @DeleteMapping("/{bugId}")
    public ResponseEntity<MessageResponse> removeBug(
            @PathVariable UUID bugId,
            @Valid @RequestBody ReasonRequest request,
            @AuthenticationPrincipal CurrentUser admin) {

        moderationService.removeBug(bugId, request.getReason(), admin.getUserId());
        return ResponseEntity.ok(new MessageResponse("Bug removed successfully"));
    }

    @PostMapping("/{bugId}/restore")
    public ResponseEntity<MessageResponse> restoreBug(
            @PathVariable UUID bugId,
            @AuthenticationPrincipal CurrentUser admin) {

        moderationService.restoreBug(bugId, admin.getUserId());
        return ResponseEntity.ok(new MessageResponse("Bug restored successfully"));
    }
}
