package com.example.bugservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request DTO for merging a duplicate (source) bug into a target bug.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeBugsRequest {

    @NotNull(message = "Source bug ID is required")
    private UUID sourceBugId;

    @NotNull(message = "Target bug ID is required")
    private UUID targetBugId;

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must not exceed 500 characters")
    private String reason;
}
