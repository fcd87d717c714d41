package com.example.bugservice.dto.response;

import com.example.bugservice.entity.Application;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.Company;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Bug report as returned by the API and stored in the cache.
 * comments and attachments are only filled for the single bug view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BugResponse {

    private UUID id;
    private String title;
    private String description;
    private String status;
    private String priority;
    private List<String> tags;
    private String operatingSystem;
    private String deviceType;
    private String appVersion;
    private String browserVersion;
    private UUID reporterId;
    private int voteCount;
    private int commentCount;
    private Instant resolvedAt;
    private Instant createdAt;
    private Instant updatedAt;

    private ApplicationInfo application;
    private CompanyInfo company;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<CommentResponse> comments;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<AttachmentResponse> attachments;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApplicationInfo {
        private UUID id;
        private String name;
        private String url;
        private UUID companyId;

        public static ApplicationInfo from(Application application) {
            return ApplicationInfo.builder()
                    .id(application.getId())
                    .name(application.getName())
                    .url(application.getUrl())
                    .companyId(application.getCompanyId())
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompanyInfo {
        private UUID id;
        private String name;
        private String domain;

        @JsonProperty("is_verified")
        private boolean verified;

        public static CompanyInfo from(Company company) {
            return CompanyInfo.builder()
                    .id(company.getId())
                    .name(company.getName())
                    .domain(company.getDomain())
                    .verified(company.isVerified())
                    .build();
        }
    }

    /**
     * Map the bug columns. Application and company are null when not found.
     */
    public static BugResponse from(BugReport bug, Application application, Company company) {
        return BugResponse.builder()
                .id(bug.getId())
                .title(bug.getTitle())
                .description(bug.getDescription())
                .status(bug.getStatus().getValue())
                .priority(bug.getPriority().getValue())
                .tags(new ArrayList<>(bug.getTags()))
                .operatingSystem(bug.getOperatingSystem())
                .deviceType(bug.getDeviceType())
                .appVersion(bug.getAppVersion())
                .browserVersion(bug.getBrowserVersion())
                .reporterId(bug.getReporterId())
                .voteCount(bug.getVoteCount())
                .commentCount(bug.getCommentCount())
                .resolvedAt(bug.getResolvedAt())
                .createdAt(bug.getCreatedAt())
                .updatedAt(bug.getUpdatedAt())
                .application(application != null ? ApplicationInfo.from(application) : null)
                .company(company != null ? CompanyInfo.from(company) : null)
                .build();
    }
}
