package com.mailbridge.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Files stored for one message, sidecars excluded
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttachmentListing {
    String account;
    String messageId;
    String path;
    /** Relative '/'-separated paths, sorted */
    List<String> files;
    List<String> directories;
    boolean hierarchical;
    int count;
    ExtractionLogDocument extractionRecord;
}
