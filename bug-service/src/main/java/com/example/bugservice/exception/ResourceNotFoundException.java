package com.example.bugservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException bugNotFound(UUID bugId) {
        return new ResourceNotFoundException(
            "BUG_NOT_FOUND",
            String.format("Bug report with ID %s not found", bugId)
        );
    }

    /**
     * Merge source missing.
     */
    public static ResourceNotFoundException sourceBugNotFound(UUID bugId) {
        return new ResourceNotFoundException(
            "SOURCE_BUG_NOT_FOUND",
            String.format("Source bug report with ID %s not found", bugId)
        );
    }

    /**
     * Merge target missing.
     */
    public static ResourceNotFoundException targetBugNotFound(UUID bugId) {
        return new ResourceNotFoundException(
            "TARGET_BUG_NOT_FOUND",
            String.format("Target bug report with ID %s not found", bugId)
        );
    }

    public static ResourceNotFoundException companyNotFound(UUID companyId) {
        return new ResourceNotFoundException(
            "COMPANY_NOT_FOUND",
            String.format("Company with ID %s not found", companyId)
        );
    }

    public static ResourceNotFoundException memberNotFound(UUID userId, UUID companyId) {
        return new ResourceNotFoundException(
            "MEMBER_NOT_FOUND",
            String.format("User %s is not a member of company %s", userId, companyId)
        );
    }
}
