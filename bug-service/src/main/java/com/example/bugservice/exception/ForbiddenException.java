package com.example.bugservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for forbidden access (HTTP 403).
 * User is authenticated but lacks permission.
 */
public class ForbiddenException extends BaseException {

    public ForbiddenException(String code, String message) {
        super(code, message, HttpStatus.FORBIDDEN);
    }

    public ForbiddenException(String message) {
        super("FORBIDDEN", message, HttpStatus.FORBIDDEN);
    }

    /**
     * Actor is neither a platform admin nor a member of the bug's assigned company.
     */
    public static ForbiddenException notCompanyMember() {
        return new ForbiddenException("INSUFFICIENT_PERMISSIONS",
            "Only company members or administrators can perform this action");
    }

    public static ForbiddenException notCompanyAdmin() {
        return new ForbiddenException("INSUFFICIENT_PERMISSIONS",
            "Only company admins can manage team members");
    }
}
