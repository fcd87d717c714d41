package com.example.bugservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Membership of a user in a company team.
 * (company_id, user_id) is unique.
 */
@Entity
@Table(name = "company_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_company_members_company_user",
                columnNames = {"company_id", "user_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyMember {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "company_id", nullable = false)
    private UUID companyId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Convert(converter = LowercaseEnumConverters.CompanyRoleConverter.class)
    @Column(name = "role", nullable = false, length = 20)
    private CompanyRole role;

    @Column(name = "added_at", nullable = false, updatable = false)
    private Instant addedAt;

    @PrePersist
    protected void onCreate() {
        if (this.addedAt == null) {
            this.addedAt = Instant.now();
        }
        if (this.role == null) {
            this.role = CompanyRole.MEMBER;
        }
    }

    public boolean isAdmin() {
        return this.role == CompanyRole.ADMIN;
    }
}
