package com.example.bugservice.dto.response;

import com.example.bugservice.entity.FileAttachment;
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
public class AttachmentResponse {

    private UUID id;
    private String filename;
    private String fileUrl;
    private Integer fileSize;
    private String mimeType;
    private Instant uploadedAt;

    public static AttachmentResponse from(FileAttachment attachment) {
        return AttachmentResponse.builder()
                .id(attachment.getId())
                .filename(attachment.getFilename())
                .fileUrl(attachment.getFileUrl())
                .fileSize(attachment.getFileSize())
                .mimeType(attachment.getMimeType())
                .uploadedAt(attachment.getUploadedAt())
                .build();
    }
}
