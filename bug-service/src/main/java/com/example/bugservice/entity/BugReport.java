package com.example.bugservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.SQLRestriction;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Bug report submitted against an application.
 *
 * Invariants:
 * - resolvedAt is set iff status is FIXED or WONT_FIX
 * - voteCount / commentCount mirror the live rows in bug_votes / comments
 *   (only ever changed through relative or recount UPDATE statements)
 *
 * applicationId, reporterId and assignedCompanyId are plain references (no JPA associations).
 * Soft delete via deletedAt; exposed to the domain as {@link DeletionState}.
 * Dynamic updates keep entity flushes from writing back stale counter columns.
 */
@Entity
@Table(name = "bug_reports")
@SQLRestriction("deleted_at IS NULL")
@DynamicUpdate
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BugReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", nullable = false, length = 5000)
    private String description;

    @Convert(converter = LowercaseEnumConverters.StatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private BugStatus status;

    @Convert(converter = LowercaseEnumConverters.PriorityConverter.class)
    @Column(name = "priority", nullable = false, length = 20)
    private BugPriority priority;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "bug_report_tags", joinColumns = @JoinColumn(name = "bug_id"))
    @Column(name = "tag", nullable = false, length = 50)
    @BatchSize(size = 100)
    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    @Column(name = "operating_system", length = 100)
    private String operatingSystem;

    @Column(name = "device_type", length = 100)
    private String deviceType;

    @Column(name = "app_version", length = 50)
    private String appVersion;

    @Column(name = "browser_version", length = 100)
    private String browserVersion;

    @Column(name = "application_id", nullable = false)
    private UUID applicationId;

    @Column(name = "reporter_id")
    private UUID reporterId;  // null for anonymous submissions

    @Column(name = "assigned_company_id")
    private UUID assignedCompanyId;

    @Column(name = "vote_count", nullable = false)
    private int voteCount;

    @Column(name = "comment_count", nullable = false)
    private int commentCount;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Integer version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
        if (status == null) {
            status = BugStatus.OPEN;
        }
        if (priority == null) {
            priority = BugPriority.MEDIUM;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public DeletionState getDeletionState() {
        return DeletionState.fromTombstone(deletedAt);
    }

    /**
     * Apply a status transition and keep resolvedAt consistent with it.
     * Entering a resolved status keeps an existing timestamp; leaving it always clears.
     */
    public void transitionTo(BugStatus newStatus, Instant at) {
        this.status = newStatus;
        if (newStatus.isResolved()) {
            if (this.resolvedAt == null) {
                this.resolvedAt = at;
            }
        } else {
            this.resolvedAt = null;
        }
    }

    public void softDelete(Instant at) {
        this.deletedAt = at;
        this.updatedAt = at;
    }

    public void restore() {
        this.deletedAt = null;
    }
}
