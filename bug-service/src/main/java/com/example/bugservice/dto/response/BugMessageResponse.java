package com.example.bugservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of bug creation and status updates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BugMessageResponse {

    private String message;
    private BugResponse bug;
}
