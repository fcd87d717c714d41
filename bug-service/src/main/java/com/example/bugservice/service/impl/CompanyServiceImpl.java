package com.example.bugservice.service.impl;

import com.example.bugservice.dto.request.AddTeamMemberRequest;
import com.example.bugservice.dto.response.ClaimCompanyResponse;
import com.example.bugservice.dto.response.CompanyListResponse;
import com.example.bugservice.dto.response.CompanyResponse;
import com.example.bugservice.dto.response.PaginationResponse;
import com.example.bugservice.dto.response.TeamMemberResponse;
import com.example.bugservice.entity.AuditAction;
import com.example.bugservice.entity.AuditLog;
import com.example.bugservice.entity.Company;
import com.example.bugservice.entity.CompanyMember;
import com.example.bugservice.entity.CompanyRole;
import com.example.bugservice.event.AuditEvent;
import com.example.bugservice.event.BugChangedEvent;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.ConflictException;
import com.example.bugservice.exception.ForbiddenException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.ApplicationRepository;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.repository.CompanyMemberRepository;
import com.example.bugservice.repository.CompanyRepository;
import com.example.bugservice.service.CompanyAccessPolicy;
import com.example.bugservice.service.CompanyService;
import com.example.bugservice.util.DomainNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class CompanyServiceImpl implements CompanyService {

    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;
    private static final int TOKEN_BYTES = 32;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final CompanyRepository companyRepository;
    private final CompanyMemberRepository memberRepository;
    private final ApplicationRepository applicationRepository;
    private final BugReportRepository bugReportRepository;
    private final CompanyAccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public CompanyListResponse listCompanies(Integer page, Integer limit, String search, Boolean verified) {
        int pageNumber = page == null || page <= 0 ? 1 : page;
        int pageSize = limit == null || limit <= 0 || limit > MAX_PAGE_SIZE ? DEFAULT_PAGE_SIZE : limit;
        String searchPattern = search == null || search.isBlank()
                ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";

        Page<Company> companies = companyRepository.findByFilters(verified, searchPattern,
                PageRequest.of(pageNumber - 1, pageSize, Sort.by("name")));

        return new CompanyListResponse(
                companies.getContent().stream().map(CompanyResponse::from).toList(),
                PaginationResponse.of(pageNumber, pageSize, companies.getTotalElements()));
    }

    @Override
    public CompanyResponse getCompany(UUID companyId) {
        return CompanyResponse.from(findCompany(companyId));
    }

    @Override
    @Transactional
    public ClaimCompanyResponse claimCompany(UUID companyId, String email, UUID userId) {
        Company company = findCompany(companyId);

        if (company.isVerified()) {
            throw BadRequestException.alreadyVerified();
        }
        if (memberRepository.existsByCompanyIdAndUserId(companyId, userId)) {
            throw ConflictException.alreadyMember(userId, companyId);
        }
        if (!DomainNames.isEmailFromDomain(email, company.getDomain())) {
            log.warn("Company claim rejected: companyId={}, domain={}", companyId, company.getDomain());
            throw BadRequestException.invalidDomain(company.getDomain());
        }

        String token = generateToken();
        company.startVerification(token, email);
        companyRepository.save(company);

        log.info("Company claim started: companyId={}, userId={}", companyId, userId);
        return new ClaimCompanyResponse("Verification started. Confirm with the token sent to " + email, token);
    }

    @Override
    @Transactional
    public CompanyResponse verifyCompany(UUID companyId, String token, UUID userId) {
        Company company = companyRepository.findByIdAndVerificationToken(companyId, token)
                .orElseThrow(BadRequestException::invalidToken);

        if (company.isVerified()) {
            throw BadRequestException.alreadyVerified();
        }

        company.markVerified(Instant.now());
        companyRepository.save(company);

        CompanyMember member = memberRepository.findByCompanyIdAndUserId(companyId, userId)
                .orElseGet(() -> CompanyMember.builder()
                        .companyId(companyId)
                        .userId(userId)
                        .build());
        member.setRole(CompanyRole.ADMIN);
        memberRepository.save(member);

        int linkedApps = applicationRepository.linkUnownedApplications(companyId,
                "%" + company.getDomain().toLowerCase(Locale.ROOT) + "%",
                "%" + company.getName().toLowerCase(Locale.ROOT) + "%");
        int assignedBugs = bugReportRepository.assignUnassignedBugsToCompany(companyId);

        eventPublisher.publishEvent(new AuditEvent(
                AuditAction.COMPANY_VERIFY,
                AuditLog.RESOURCE_COMPANY,
                companyId,
                String.format("Company verified: %s (%s). Applications linked: %d. Bugs assigned: %d",
                        company.getName(), company.getDomain(), linkedApps, assignedBugs),
                userId));
        eventPublisher.publishEvent(BugChangedEvent.listsOnly());

        log.info("Company verified: companyId={}, userId={}, linkedApps={}, assignedBugs={}",
                companyId, userId, linkedApps, assignedBugs);
        return CompanyResponse.from(company);
    }

    @Override
    @Transactional
    public TeamMemberResponse addTeamMember(UUID companyId, AddTeamMemberRequest request, UUID actorId) {
        Company company = findCompany(companyId);
        requireCompanyAdmin(companyId, actorId);

        CompanyRole role = CompanyRole.MEMBER;
        if (request.getRole() != null && !request.getRole().isBlank()) {
            role = CompanyRole.fromValue(request.getRole())
                    .orElseThrow(() -> BadRequestException.invalidRole(request.getRole()));
        }
        if (!DomainNames.isEmailFromDomain(request.getEmail(), company.getDomain())) {
            throw BadRequestException.invalidDomain(company.getDomain());
        }
        if (memberRepository.existsByCompanyIdAndUserId(companyId, request.getUserId())) {
            throw ConflictException.alreadyMember(request.getUserId(), companyId);
        }

        CompanyMember member = memberRepository.save(CompanyMember.builder()
                .companyId(companyId)
                .userId(request.getUserId())
                .role(role)
                .build());

        log.info("Team member added: companyId={}, userId={}, role={}, by={}",
                companyId, request.getUserId(), role.getValue(), actorId);
        return TeamMemberResponse.from(member);
    }

    @Override
    @Transactional
    public void removeTeamMember(UUID companyId, UUID memberUserId, UUID actorId) {
        findCompany(companyId);
        requireCompanyAdmin(companyId, actorId);

        CompanyMember member = memberRepository.findByCompanyIdAndUserId(companyId, memberUserId)
                .orElseThrow(() -> ResourceNotFoundException.memberNotFound(memberUserId, companyId));

        if (member.isAdmin() && memberRepository.countByCompanyIdAndRole(companyId, CompanyRole.ADMIN) <= 1) {
            throw BadRequestException.lastAdmin();
        }

        memberRepository.delete(member);
        log.info("Team member removed: companyId={}, userId={}, by={}", companyId, memberUserId, actorId);
    }

    private Company findCompany(UUID companyId) {
        return companyRepository.findById(companyId)
                .orElseThrow(() -> ResourceNotFoundException.companyNotFound(companyId));
    }

    private void requireCompanyAdmin(UUID companyId, UUID userId) {
        if (!accessPolicy.isCompanyAdmin(userId, companyId)) {
            log.warn("Team management denied: companyId={}, userId={}", companyId, userId);
            throw ForbiddenException.notCompanyAdmin();
        }
    }

    private static String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }
}
