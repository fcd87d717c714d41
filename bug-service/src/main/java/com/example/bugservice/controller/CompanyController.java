package com.example.bugservice.controller;

import com.example.bugservice.dto.request.AddTeamMemberRequest;
import com.example.bugservice.dto.request.ClaimCompanyRequest;
import com.example.bugservice.dto.request.VerifyCompanyRequest;
import com.example.bugservice.dto.response.*;
import com.example.bugservice.exception.UnauthorizedException;
import com.example.bugservice.security.CurrentUser;
import com.example.bugservice.service.CompanyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST Controller for company pages.
 *
 * Authorization:
 * - GET /companies, GET /companies/{id}: PUBLIC
 * - POST /companies/{id}/claim, POST /companies/{id}/verify: AUTHENTICATED
 * - POST/DELETE /companies/{id}/members: company ADMIN
 */
@RestController
@RequestMapping("/companies")
@RequiredArgsConstructor
public class CompanyController {

    private final CompanyService companyService;

    @GetMapping
    public ResponseEntity<CompanyListResponse> listCompanies(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Boolean verified) {

        return ResponseEntity.ok(companyService.listCompanies(page, limit, search, verified));
    }

    @GetMapping("/{companyId}")
    public ResponseEntity<CompanyDetailResponse> getCompany(@PathVariable UUID companyId) {
        return ResponseEntity.ok(new CompanyDetailResponse(null, companyService.getCompany(companyId)));
    }

    @PostMapping("/{companyId}/claim")
    public ResponseEntity<ClaimCompanyResponse> claimCompany(
            @PathVariable UUID companyId,
            @Valid @RequestBody ClaimCompanyRequest request,
            @AuthenticationPrincipal CurrentUser user) {

        return ResponseEntity.ok(companyService.claimCompany(companyId, request.getEmail(),
                requireUser(user).getUserId()));
    }

    @PostMapping("/{companyId}/verify")
    public ResponseEntity<CompanyDetailResponse> verifyCompany(
            @PathVariable UUID companyId,
            @Valid @RequestBody VerifyCompanyRequest request,
            @AuthenticationPrincipal CurrentUser user) {

        CompanyResponse company = companyService.verifyCompany(companyId, request.getToken(),
                requireUser(user).getUserId());
        return ResponseEntity.ok(new CompanyDetailResponse("Company verified successfully", company));
    }

    @PostMapping("/{companyId}/members")
    public ResponseEntity<TeamMemberMessageResponse> addTeamMember(
            @PathVariable UUID companyId,
            @Valid @RequestBody AddTeamMemberRequest request,
            @AuthenticationPrincipal CurrentUser user) {

        TeamMemberResponse member = companyService.addTeamMember(companyId, request, requireUser(user).getUserId());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new TeamMemberMessageResponse("Team member added successfully", member));
    }

    @DeleteMapping("/{companyId}/members/{userId}")
    public ResponseEntity<MessageResponse> removeTeamMember(
            @PathVariable UUID companyId,
            @PathVariable UUID userId,
            @AuthenticationPrincipal CurrentUser user) {

        companyService.removeTeamMember(companyId, userId, requireUser(user).getUserId());
        return ResponseEntity.ok(new MessageResponse("Team member removed successfully"));
    }

    private static CurrentUser requireUser(CurrentUser user) {
        if (user == null) {
            throw UnauthorizedException.authenticationRequired();
        }
        return user;
    }
}
