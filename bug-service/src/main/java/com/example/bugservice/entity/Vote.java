package com.example.bugservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's upvote on a bug. Row existence is the vote; there is no other payload.
 * Rows are inserted and deleted through native statements in {@link com.example.bugservice.repository.VoteRepositoryCustom}.
 */
@Entity
@Table(name = "bug_votes")
@IdClass(VoteId.class)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vote {

    @Id
    @Column(name = "bug_id", nullable = false)
    private UUID bugId;

    @Id
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
