package com.example.bugservice.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record for administrative actions.
 * Immutable once written: builder for creation, getters only.
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_logs_action", columnList = "action"),
    @Index(name = "idx_audit_logs_user", columnList = "user_id"),
    @Index(name = "idx_audit_logs_created_at", columnList = "created_at")
})
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "action", nullable = false, length = 100)
    private String action;

    @Column(name = "resource", nullable = false, length = 100)
    private String resource;

    @Column(name = "resource_id")
    private UUID resourceId;

    @Column(name = "details", length = 2000)
    private String details;

    // Actor
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    // Request context
    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static final String RESOURCE_BUG = "bug_report";
    public static final String RESOURCE_COMPANY = "company";

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }

    protected AuditLog() {
    }

    private AuditLog(Builder builder) {
        this.action = builder.action;
        this.resource = builder.resource;
        this.resourceId = builder.resourceId;
        this.details = builder.details;
        this.userId = builder.userId;
        this.ipAddress = builder.ipAddress;
        this.userAgent = builder.userAgent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String action;
        private String resource;
        private UUID resourceId;
        private String details;
        private UUID userId;
        private String ipAddress;
        private String userAgent;

        public Builder action(AuditAction action) {
            this.action = action.getValue();
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder resourceId(UUID resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder userId(UUID userId) {
            this.userId = userId;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public AuditLog build() {
            return new AuditLog(this);
        }
    }

    public UUID getId() { return id; }
    public String getAction() { return action; }
    public String getResource() { return resource; }
    public UUID getResourceId() { return resourceId; }
    public String getDetails() { return details; }
    public UUID getUserId() { return userId; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public Instant getCreatedAt() { return createdAt; }
}
