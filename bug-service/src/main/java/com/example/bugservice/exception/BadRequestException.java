package com.example.bugservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for invalid input and rejected business requests.
 * Returns HTTP 400 BAD_REQUEST.
 */
public class BadRequestException extends BaseException {

    public BadRequestException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public static BadRequestException validation(String message) {
        return new BadRequestException("VALIDATION_ERROR", message);
    }

    public static BadRequestException invalidTitle() {
        return new BadRequestException("INVALID_TITLE",
            "Title must be between 5 and 255 characters and contain no malicious content");
    }

    public static BadRequestException invalidDescription() {
        return new BadRequestException("INVALID_DESCRIPTION",
            "Description must be between 10 and 5000 characters and contain no malicious content");
    }

    public static BadRequestException invalidApplicationName() {
        return new BadRequestException("INVALID_APPLICATION_NAME",
            "Application name must be between 1 and 255 characters");
    }

    public static BadRequestException invalidApplicationUrl() {
        return new BadRequestException("INVALID_APPLICATION_URL", "Invalid application URL format");
    }

    public static BadRequestException invalidContactEmail() {
        return new BadRequestException("INVALID_CONTACT_EMAIL", "Invalid contact email format");
    }

    public static BadRequestException invalidStatus(String status) {
        return new BadRequestException("INVALID_STATUS",
            String.format("Invalid status: %s. Expected one of: open, reviewing, fixed, wont_fix", status));
    }

    public static BadRequestException invalidPriority(String priority) {
        return new BadRequestException("INVALID_PRIORITY",
            String.format("Invalid priority: %s. Expected one of: low, medium, high, critical", priority));
    }

    public static BadRequestException tooManyTags(int max) {
        return new BadRequestException("TOO_MANY_TAGS",
            String.format("Maximum %d tags allowed", max));
    }

    public static BadRequestException invalidContent() {
        return new BadRequestException("INVALID_CONTENT",
            "Content must be between 1 and 2000 characters and contain no malicious content");
    }

    public static BadRequestException invalidMerge() {
        return new BadRequestException("INVALID_MERGE", "Source and target bugs must be different");
    }

    public static BadRequestException bugNotDeleted() {
        return new BadRequestException("BUG_NOT_DELETED", "Bug report is not deleted");
    }

    public static BadRequestException invalidDomain(String domain) {
        return new BadRequestException("INVALID_DOMAIN",
            String.format("Email must be from domain: %s", domain));
    }

    public static BadRequestException alreadyVerified() {
        return new BadRequestException("ALREADY_VERIFIED", "Company is already verified");
    }

    public static BadRequestException invalidToken() {
        return new BadRequestException("INVALID_TOKEN", "Invalid or expired verification token");
    }

    public static BadRequestException invalidRole(String role) {
        return new BadRequestException("INVALID_ROLE",
            String.format("Invalid role: %s. Expected: member or admin", role));
    }

    public static BadRequestException lastAdmin() {
        return new BadRequestException("LAST_ADMIN", "Cannot remove the last admin of a company");
    }
}
