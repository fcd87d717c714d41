package com.example.bugservice.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception for conflict errors (HTTP 409).
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    public static ConflictException alreadyMember(UUID userId, UUID companyId) {
        return new ConflictException(
            "ALREADY_MEMBER",
            String.format("User %s is already a member of company %s", userId, companyId)
        );
    }

    public static ConflictException concurrentUpdate() {
        return new ConflictException(
            "CONCURRENT_UPDATE",
            "The resource was modified by another request. Please retry."
        );
    }
}
