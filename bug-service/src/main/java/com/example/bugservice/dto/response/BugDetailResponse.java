package com.example.bugservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single bug view: {@code {"bug": {...}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BugDetailResponse {

    private BugResponse bug;
}
