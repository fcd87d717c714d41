package com.example.bugservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for unauthorized access (HTTP 401).
 */
public class UnauthorizedException extends BaseException {

    public UnauthorizedException(String message) {
        super("UNAUTHORIZED", message, HttpStatus.UNAUTHORIZED);
    }

    public static UnauthorizedException authenticationRequired() {
        return new UnauthorizedException("Authentication required");
    }
}
