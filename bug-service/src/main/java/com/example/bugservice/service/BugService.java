package com.example.bugservice.service;

import com.example.bugservice.dto.request.BugListQuery;
import com.example.bugservice.dto.request.CreateBugRequest;
import com.example.bugservice.dto.response.BugListResponse;
import com.example.bugservice.dto.response.BugResponse;

import java.util.UUID;

/**
 * Bug submission and cached reads.
 */
public interface BugService {

    /**
     * Create a bug report. reporterId is null for anonymous submissions.
     */
    BugResponse createBug(CreateBugRequest request, UUID reporterId);

    BugListResponse listBugs(BugListQuery query);

    BugResponse getBug(UUID bugId);
}
