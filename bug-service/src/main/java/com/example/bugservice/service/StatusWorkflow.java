package com.example.bugservice.service;

import com.example.bugservice.dto.response.BugResponse;
import com.example.bugservice.security.CurrentUser;

import java.util.UUID;

/**
 * Status transitions of a bug report.
 * Every transition between open, reviewing, fixed and wont_fix is allowed;
 * only who may perform it is restricted.
 */
public interface StatusWorkflow {

    BugResponse updateStatus(UUID bugId, String status, CurrentUser actor);
}
