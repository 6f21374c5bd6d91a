package com.mailbridge.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Content of the per-message attachments.json sidecar
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentMetadataDocument {
    private String account;
    private String messageId;
    private String downloadTime;
    private int totalAttachments;
    private int successfulDownloads;
    @Builder.Default
    private List<StoredAttachment> attachments = new ArrayList<>();
}
