package com.example.bugservice.dto.response;

import com.example.bugservice.entity.CompanyMember;
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
public class TeamMemberResponse {

    private UUID id;
    private UUID companyId;
    private UUID userId;
    private String role;
    private Instant addedAt;

    public static TeamMemberResponse from(CompanyMember member) {
        return TeamMemberResponse.builder()
                .id(member.getId())
                .companyId(member.getCompanyId())
                .userId(member.getUserId())
                .role(member.getRole().getValue())
                .addedAt(member.getAddedAt())
                .build();
    }
}
