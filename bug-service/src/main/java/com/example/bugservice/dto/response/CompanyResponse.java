package com.example.bugservice.dto.response;

import com.example.bugservice.entity.Company;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Public company view. Verification token and email are never exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyResponse {

    private UUID id;
    private String name;
    private String domain;

    @JsonProperty("is_verified")
    private boolean verified;

    private Instant verifiedAt;
    private Instant createdAt;

    public static CompanyResponse from(Company company) {
        return CompanyResponse.builder()
                .id(company.getId())
                .name(company.getName())
                .domain(company.getDomain())
                .verified(company.isVerified())
                .verifiedAt(company.getVerifiedAt())
                .createdAt(company.getCreatedAt())
                .build();
    }
}
