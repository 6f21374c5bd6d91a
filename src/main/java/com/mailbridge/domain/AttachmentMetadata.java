package com.mailbridge.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Serializable attachment description without the MIME handle
 */
@Value
@Builder
public class AttachmentMetadata {
    String filename;
    String originalFilename;
    String contentType;
    long size;
}
