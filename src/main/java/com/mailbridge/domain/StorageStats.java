package com.mailbridge.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StorageStats {
    long totalSizeBytes;
    double totalSizeMb;
    long totalFiles;
    int accounts;
    int messages;
    String basePath;
}
