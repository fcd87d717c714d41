package com.example.bugservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeResponse {

    private String message;
    private UUID sourceBugId;
    private UUID targetBugId;
    private String reason;
    private BugResponse targetBug;
}
