package com.example.bugservice.service;

import com.example.bugservice.dto.request.AddTeamMemberRequest;
import com.example.bugservice.dto.response.ClaimCompanyResponse;
import com.example.bugservice.dto.response.CompanyListResponse;
import com.example.bugservice.dto.response.CompanyResponse;
import com.example.bugservice.dto.response.TeamMemberResponse;

import java.util.UUID;

/**
 * Company pages: listing, claim and domain verification, team management.
 */
public interface CompanyService {

    CompanyListResponse listCompanies(Integer page, Integer limit, String search, Boolean verified);

    CompanyResponse getCompany(UUID companyId);

    /**
     * Start a claim. The email must belong to the company domain.
     */
    ClaimCompanyResponse claimCompany(UUID companyId, String email, UUID userId);

    /**
     * Complete a claim: verify the company, make the caller its admin and take
     * over matching unowned applications and their unassigned bugs.
     */
    CompanyResponse verifyCompany(UUID companyId, String token, UUID userId);

    TeamMemberResponse addTeamMember(UUID companyId, AddTeamMemberRequest request, UUID actorId);

    void removeTeamMember(UUID companyId, UUID memberUserId, UUID actorId);
}
