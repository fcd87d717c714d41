package com.example.bugservice.dto.response;

import com.example.bugservice.entity.AuditLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogResponse {

    private UUID id;
    private String action;
    private String resource;
    private UUID resourceId;
    private String details;
    private UUID userId;
    private String ipAddress;
    private String userAgent;
    private Instant createdAt;

    public static AuditLogResponse from(AuditLog log) {
        return AuditLogResponse.builder()
                .id(log.getId())
                .action(log.getAction())
                .resource(log.getResource())
                .resourceId(log.getResourceId())
                .details(log.getDetails())
                .userId(log.getUserId())
                .ipAddress(log.getIpAddress())
                .userAgent(log.getUserAgent())
                .createdAt(log.getCreatedAt())
                .build();
    }
}
