package com.mailbridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * MailBridge configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "mailbridge")
public class MailBridgeProperties {

    /**
     * All message timestamps are normalized to this offset
     */
    private String timezoneOffset = "+00:00";

    /**
     * Optional JSON file with an "accounts" object keyed by address
     */
    private String accountsFile;

    private List<AccountSettings> accounts = new ArrayList<>();

    private Storage storage = new Storage();
    private Fetch fetch = new Fetch();
    private Search search = new Search();
    private Send send = new Send();
    private Mail mail = new Mail();

    public ZoneOffset getZoneOffset() {
        String configured = timezoneOffset == null ? "" : timezoneOffset.trim();
        if (configured.isEmpty() || "Z".equalsIgnoreCase(configured)) {
            return ZoneOffset.UTC;
        }
        return ZoneOffset.of(configured);
    }

    @Data
    public static class Storage {
        private String basePath = "attachments";
        private boolean autoExtract = true;
        private int maxExtractionDepth = 10;
    }

    @Data
    public static class Fetch {
        private int defaultLimit = 10;
        private int maxLimit = 1000;
    }

    @Data
    public static class Search {
        private int defaultPageSize = 5;
        private int maxPageSize = 50;
        private int scanBudgetFactor = 10;
    }

    @Data
    public static class Send {
        private long maxAttachmentSize = 26214400L; // 25MB
    }

    @Data
    public static class Mail {
        private long connectionTimeout = 10000L;
        private long timeout = 30000L;
        private boolean debug = false;
    }
}
