package com.mailbridge.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Content of the per-message extraction_log.json sidecar
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionLogDocument {
    private String messageId;
    private String extractionTime;
    private ExtractionRecord extractionLog;
}
