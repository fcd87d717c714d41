package com.example.bugservice.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for comments and company responses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddCommentRequest {

    private String content;
}
