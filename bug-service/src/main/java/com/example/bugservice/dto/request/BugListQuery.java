package com.example.bugservice.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw query parameters of GET /bugs. Normalised by the service; nothing here is rejected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BugListQuery {

    private Integer page;
    private Integer limit;
    private String search;
    private String status;
    private String priority;

    // Comma-separated; every tag must match
    private String tags;

    private String application;
    private String company;
    private String sort;
}
