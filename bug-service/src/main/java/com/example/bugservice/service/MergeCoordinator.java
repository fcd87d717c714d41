package com.example.bugservice.service;

import com.example.bugservice.dto.request.MergeBugsRequest;
import com.example.bugservice.dto.response.MergeResponse;

import java.util.UUID;

/**
 * Merges a duplicate bug report (source) into another (target).
 * All row moves happen in one transaction; the source ends soft-deleted.
 */
public interface MergeCoordinator {

    MergeResponse merge(MergeBugsRequest request, UUID adminId);
}
