package com.example.bugservice.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Error envelope shared by every endpoint:
 * {"error": {"code", "message", "timestamp", "details"?}}.
 */
@Builder
public record ErrorResponse(
    Error error
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Error(
        String code,
        String message,
        Instant timestamp,
        Map<String, String> details
    ) {}

    public static ErrorResponse of(String code, String message) {
        return of(code, message, null);
    }

    public static ErrorResponse of(String code, String message, Map<String, String> details) {
        return ErrorResponse.builder()
                .error(Error.builder()
                        .code(code)
                        .message(message)
                        .timestamp(Instant.now())
                        .details(details)
                        .build())
                .build();
    }
}
