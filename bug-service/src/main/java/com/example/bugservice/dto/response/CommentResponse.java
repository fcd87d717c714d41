package com.example.bugservice.dto.response;

import com.example.bugservice.entity.Comment;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentResponse {

    private UUID id;
    private UUID bugId;
    private UUID userId;
    private String content;

    @JsonProperty("is_company_response")
    private boolean companyResponse;

    private Instant createdAt;

    public static CommentResponse from(Comment comment) {
        return CommentResponse.builder()
                .id(comment.getId())
                .bugId(comment.getBugId())
                .userId(comment.getUserId())
                .content(comment.getContent())
                .companyResponse(comment.isCompanyResponse())
                .createdAt(comment.getCreatedAt())
                .build();
    }
}
