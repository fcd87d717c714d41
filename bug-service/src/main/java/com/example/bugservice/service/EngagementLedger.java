package com.example.bugservice.service;

import com.example.bugservice.dto.response.CommentResponse;
import com.example.bugservice.dto.response.VoteResponse;
import com.example.bugservice.security.CurrentUser;

import java.util.UUID;

/**
 * Votes and comments on bug reports, keeping vote_count and comment_count
 * equal to the live rows.
 */
public interface EngagementLedger {

    /**
     * Remove the user's vote if present, add it otherwise.
     * The result's voted flag is true when the vote now exists.
     */
    VoteResponse toggleVote(UUID bugId, UUID userId);

    /**
     * Add a comment. It counts as a company response when the author is a member
     * of the bug's assigned company.
     */
    CommentResponse addComment(UUID bugId, UUID userId, String content);

    /**
     * Add a comment always marked as a company response. Admins and members of the
     * assigned company only.
     */
    CommentResponse addCompanyResponse(UUID bugId, CurrentUser actor, String content);
}
