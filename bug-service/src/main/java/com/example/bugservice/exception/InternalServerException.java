package com.example.bugservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for failures of a primary effect (HTTP 500).
 */
public class InternalServerException extends BaseException {

    public InternalServerException(String code, String message, Throwable cause) {
        super(code, message, HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }

    public static InternalServerException auditLogFailed(Throwable cause) {
        return new InternalServerException("AUDIT_LOG_FAILED", "Failed to log audit action", cause);
    }
}
