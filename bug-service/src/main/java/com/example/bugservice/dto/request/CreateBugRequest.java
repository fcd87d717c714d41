package com.example.bugservice.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for submitting a bug report.
 * Field rules are enforced by the service so each field reports its own error code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBugRequest {

    private String title;
    private String description;
    private String priority;
    private List<String> tags;

    // Optional technical context; invalid values are dropped
    private String operatingSystem;
    private String deviceType;
    private String appVersion;
    private String browserVersion;

    private String applicationName;
    private String applicationUrl;
    private String contactEmail;
}
