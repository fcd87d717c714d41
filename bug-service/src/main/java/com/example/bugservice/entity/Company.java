package com.example.bugservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Company owning one or more applications.
 * Companies with a placeholder ".app" domain are unclaimed pages that cannot be verified.
 */
@Entity
@Table(name = "companies")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "domain", nullable = false, unique = true, length = 255)
    private String domain;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Column(name = "verification_token", length = 255)
    private String verificationToken;

    @Column(name = "verification_email", length = 255)
    private String verificationEmail;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void startVerification(String token, String email) {
        this.verificationToken = token;
        this.verificationEmail = email;
    }

    public void markVerified(Instant at) {
        this.verified = true;
        this.verifiedAt = at;
        this.verificationToken = null;
    }
}
