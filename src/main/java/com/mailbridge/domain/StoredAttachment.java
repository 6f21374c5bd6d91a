package com.mailbridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of storing one attachment locally
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StoredAttachment {
    private String filename;
    private String originalFilename;
    private String safeFilename;
    private String contentType;
    private long size;
    private String localPath;
    private DownloadStatus status;
    private String downloadTime;
    private String error;

    public static StoredAttachment failed(AttachmentRef ref, String error) {
        return StoredAttachment.builder()
                .filename(ref.getFilename())
                .originalFilename(ref.getOriginalFilename())
                .contentType(ref.getContentType())
                .size(ref.getSize())
                .status(DownloadStatus.FAILED)
                .error(error)
                .build();
    }
}
