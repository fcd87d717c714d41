package com.example.bugservice.service;

import com.example.bugservice.dto.response.AttachmentResponse;
import com.example.bugservice.dto.response.BugResponse;
import com.example.bugservice.dto.response.CommentResponse;
import com.example.bugservice.entity.Application;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.Company;
import com.example.bugservice.repository.ApplicationRepository;
import com.example.bugservice.repository.CommentRepository;
import com.example.bugservice.repository.CompanyRepository;
import com.example.bugservice.repository.FileAttachmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds bug DTOs with their application and company, batching lookups for lists.
 */
@Component
@RequiredArgsConstructor
public class BugResponseAssembler {

    private final ApplicationRepository applicationRepository;
    private final CompanyRepository companyRepository;
    private final CommentRepository commentRepository;
    private final FileAttachmentRepository attachmentRepository;

    public BugResponse toResponse(BugReport bug) {
        Application application = bug.getApplicationId() != null
                ? applicationRepository.findById(bug.getApplicationId()).orElse(null)
                : null;
        Company company = bug.getAssignedCompanyId() != null
                ? companyRepository.findById(bug.getAssignedCompanyId()).orElse(null)
                : null;
        return BugResponse.from(bug, application, company);
    }

    /**
     * Single bug view: adds comments (oldest first) and attachments.
     */
    public BugResponse toDetailResponse(BugReport bug) {
        BugResponse response = toResponse(bug);
        response.setComments(commentRepository.findByBugIdOrderByCreatedAtAsc(bug.getId()).stream()
                .map(CommentResponse::from)
                .toList());
        response.setAttachments(attachmentRepository.findByBugIdOrderByUploadedAtAsc(bug.getId()).stream()
                .map(AttachmentResponse::from)
                .toList());
        return response;
    }

    public List<BugResponse> toResponses(List<BugReport> bugs) {
        Map<UUID, Application> applications = index(
                applicationRepository.findAllById(ids(bugs, BugReport::getApplicationId)), Application::getId);
        Map<UUID, Company> companies = index(
                companyRepository.findAllById(ids(bugs, BugReport::getAssignedCompanyId)), Company::getId);

        return bugs.stream()
                .map(bug -> BugResponse.from(bug,
                        applications.get(bug.getApplicationId()),
                        companies.get(bug.getAssignedCompanyId())))
                .toList();
    }

    private static Set<UUID> ids(List<BugReport> bugs, Function<BugReport, UUID> extractor) {
        return bugs.stream()
                .map(extractor)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    private static <T> Map<UUID, T> index(Collection<T> items, Function<T, UUID> idOf) {
        return items.stream().collect(Collectors.toMap(idOf, Function.identity()));
    }
}
