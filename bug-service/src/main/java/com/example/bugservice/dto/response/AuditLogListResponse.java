package com.example.bugservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogListResponse {

    private List<AuditLogResponse> logs;
    private PaginationResponse pagination;
}
