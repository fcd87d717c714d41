package com.example.bugservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BugListResponse {

    private List<BugResponse> bugs;
    private PaginationResponse pagination;
}
