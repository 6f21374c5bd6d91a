package com.mailbridge.service;

import com.mailbridge.client.MailClient;
import com.mailbridge.client.MailClientFactory;
import com.mailbridge.config.AccountRegistry;
import com.mailbridge.config.AccountSettings;
import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.AttachmentListing;
import com.mailbridge.domain.AttachmentMetadataDocument;
import com.mailbridge.domain.DateRange;
import com.mailbridge.domain.ExtractionRecord;
import com.mailbridge.domain.FetchFilter;
import com.mailbridge.domain.MailMessage;
import com.mailbridge.domain.MessageView;
import com.mailbridge.domain.OutgoingMail;
import com.mailbridge.domain.SearchField;
import com.mailbridge.domain.SearchPage;
import com.mailbridge.domain.SearchRequest;
import com.mailbridge.domain.StoredAttachment;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.util.DateParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tool invocation boundary
 * - validates arguments and resolves the account before any I/O
 * - opens one client per invocation and closes it when done
 * - stores attachments of every returned message
 * - turns every failure into an error response
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailToolService {

    public static final String FETCH_EMAILS = "fetch_emails";
    public static final String SEARCH_EMAILS = "search_emails";
    public static final String SEND_EMAIL = "send_email";
    public static final String LIST_ATTACHMENTS = "list_attachments";
    public static final String GET_ATTACHMENT_INFO = "get_attachment_info";
    public static final String READ_ATTACHMENT = "read_attachment";
    public static final String GET_STORAGE_STATS = "get_storage_stats";
    public static final String CLEANUP_ATTACHMENTS = "cleanup_attachments";
    public static final String EXTRACT_ARCHIVES = "extract_archives";
    public static final String LIST_ACCOUNTS = "list_accounts";

    private static final DateTimeFormatter REQUEST_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS");

    private final AccountRegistry accountRegistry;
    private final MailClientFactory clientFactory;
    private final AttachmentStorageService storageService;
    private final ArchiveService archiveService;
    private final MailBridgeProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Dispatch by operation name
     */
    public Mono<ToolResponse> invoke(String operation, Map<String, Object> arguments) {
        ToolArguments args = ToolArguments.of(arguments);
        return switch (operation) {
            case FETCH_EMAILS -> fetchEmails(args);
            case SEARCH_EMAILS -> searchEmails(args);
            case SEND_EMAIL -> sendEmail(args);
            case LIST_ATTACHMENTS -> listAttachments(args);
            case GET_ATTACHMENT_INFO -> getAttachmentInfo(args);
            case READ_ATTACHMENT -> readAttachment(args);
            case GET_STORAGE_STATS -> getStorageStats();
            case CLEANUP_ATTACHMENTS -> cleanupAttachments(args);
            case EXTRACT_ARCHIVES -> extractArchives(args);
            case LIST_ACCOUNTS -> listAccounts();
            default -> Mono.just(error(null, MailBridgeException.validation("Unknown operation: " + operation)));
        };
    }

    public Mono<ToolResponse> fetchEmails(ToolArguments args) {
        return execute(FETCH_EMAILS, args, requestId -> {
            FetchFilter filter = fetchFilter(args);
            AccountSettings account = accountRegistry.resolve(args.getString("email_address"));

            try (MailClient client = clientFactory.create(account)) {
                List<MailMessage> messages = client.fetch(filter);
                List<MessageView> views = materialize(account, messages);

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("totalEmails", views.size());
                data.put("folder", filter.getFolder());
                data.put("emails", views);
                log.info("[{}] Fetched {} emails", requestId, views.size());
                return success(requestId, "Fetched " + views.size() + " emails", data);
            }
        });
    }

    public Mono<ToolResponse> searchEmails(ToolArguments args) {
        return execute(SEARCH_EMAILS, args, requestId -> {
            SearchRequest request = searchRequest(args);
            AccountSettings account = accountRegistry.resolve(args.getString("email_address"));

            try (MailClient client = clientFactory.create(account)) {
                SearchPage page = client.search(request);
                List<MessageView> views = materialize(account, page.getMessages());

                Map<String, Object> params = new LinkedHashMap<>();
                params.put("keywords", request.getKeywords());
                params.put("searchType", request.getField());
                params.put("lastId", request.getLastId());

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("emails", views);
                data.put("totalFound", views.size());
                data.put("pageSize", request.getPageSize());
                data.put("hasMore", page.isHasMore());
                data.put("lastId", page.getLastId());
                data.put("searchParams", params);
                return success(requestId, "Search completed for keywords: '" + request.getKeywords() + "'", data);
            }
        });
    }

    public Mono<ToolResponse> sendEmail(ToolArguments args) {
        return execute(SEND_EMAIL, args, requestId -> {
            OutgoingMail mail = OutgoingMail.builder()
                    .to(args.getList("to_addresses"))
                    .cc(args.getList("cc_addresses"))
                    .bcc(args.getList("bcc_addresses"))
                    .subject(args.getString("subject"))
                    .body(args.getString("body"))
                    .htmlBody(args.getString("html_body"))
                    .attachmentPaths(args.getList("attachment_paths"))
                    .build();
            if (mail.getTo().isEmpty()) {
                throw MailBridgeException.validation("At least one recipient email address is required");
            }
            AccountSettings account = accountRegistry.resolve(args.getString("email_address"));

            try (MailClient client = clientFactory.create(account)) {
                client.send(mail);
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("from", account.getAddress());
            data.put("toAddresses", mail.getTo());
            data.put("ccAddresses", mail.getCc());
            data.put("bccAddresses", mail.getBcc());
            data.put("subject", mail.getSubject());
            data.put("attachments", mail.getAttachmentPaths().size());
            data.put("sentAt", now());
            data.put("smtpServer", account.getSmtpHost() + ":" + account.getSmtpPort());
            return success(requestId, "Email sent successfully to " + String.join(", ", mail.getTo()), data);
        });
    }

    public Mono<ToolResponse> listAttachments(ToolArguments args) {
        return execute(LIST_ATTACHMENTS, args, requestId -> {
            String messageId = requireMessageId(args);
            AccountSettings account = accountRegistry.resolve(args.getString("email_address"));
            AttachmentListing listing = storageService.list(account.getAddress(), messageId);
            String message = listing.getCount() == 0
                    ? "No attachments found for email " + messageId
                    : "Found " + listing.getCount() + " files for email " + messageId;
            return success(requestId, message, listing);
        });
    }

    public Mono<ToolResponse> getAttachmentInfo(ToolArguments args) {
        return execute(GET_ATTACHMENT_INFO, args, requestId -> {
            String messageId = requireMessageId(args);
            AccountSettings account = accountRegistry.resolve(args.getString("email_address"));
            Optional<AttachmentMetadataDocument> metadata = storageService.getMetadata(account.getAddress(), messageId);
            if (metadata.isEmpty()) {
                throw new MailBridgeException(ErrorKind.ATTACHMENT_FAILURE, "No attachment info found for email " + messageId);
            }
            return success(requestId, "Attachment info for email " + messageId, metadata.get());
        });
    }

    public Mono<ToolResponse> readAttachment(ToolArguments args) {
        return execute(READ_ATTACHMENT, args, requestId -> {
            String messageId = requireMessageId(args);
            String filename = args.getString("filename");
            if (filename == null) {
                throw MailBridgeException.validation("filename is required");
            }
            AccountSettings account = accountRegistry.resolve(args.getString("email_address"));
            byte[] content = storageService.read(account.getAddress(), messageId, filename)
                    .orElseThrow(() -> new MailBridgeException(ErrorKind.ATTACHMENT_FAILURE,
                            "Attachment " + filename + " not found for email " + messageId));

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("filename", filename);
            data.put("emailUid", messageId);
            data.put("size", content.length);
            data.put("contentBase64", Base64.getEncoder().encodeToString(content));
            return success(requestId, "Read attachment " + filename, data);
        });
    }

    public Mono<ToolResponse> getStorageStats() {
        return execute(GET_STORAGE_STATS, ToolArguments.of(Map.of()), requestId ->
                success(requestId, "Storage statistics", storageService.getStorageStats()));
    }

    public Mono<ToolResponse> cleanupAttachments(ToolArguments args) {
        return execute(CLEANUP_ATTACHMENTS, args, requestId -> {
            int days = integer(args, "days", 30);
            int removed = storageService.cleanup(days);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("removedDirectories", removed);
            data.put("days", days);
            return success(requestId, "Cleaned up " + removed + " old attachment directories", data);
        });
    }

    public Mono<ToolResponse> extractArchives(ToolArguments args) {
        return execute(EXTRACT_ARCHIVES, args, requestId -> {
            String messageId = requireMessageId(args);
            AccountSettings account = accountRegistry.resolve(args.getString("email_address"));
            Path dir = storageService.messageDir(account.getAddress(), messageId);
            if (!Files.isDirectory(dir)) {
                throw MailBridgeException.validation("No stored attachments for email " + messageId);
            }
            ExtractionRecord record = archiveService.processDirectory(dir);
            return success(requestId, "Extracted " + record.getTotalExtracted() + " files", record);
        });
    }

    public Mono<ToolResponse> listAccounts() {
        return execute(LIST_ACCOUNTS, ToolArguments.of(Map.of()), requestId -> {
            List<Map<String, Object>> accounts = new ArrayList<>();
            for (AccountSettings account : accountRegistry.listAccounts()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("emailAddress", account.getAddress());
                entry.put("displayName", account.getDisplayName());
                entry.put("protocol", account.getProtocol());
                entry.put("enabled", account.isEnabled());
                entry.put("defaultFolder", account.getDefaultFolder());
                accounts.add(entry);
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("count", accounts.size());
            data.put("accounts", accounts);
            return success(requestId, "Found " + accounts.size() + " accounts", data);
        });
    }

    /**
     * Validate fetch arguments; all problems are reported together
     */
    FetchFilter fetchFilter(ToolArguments args) {
        List<String> errors = new ArrayList<>();
        if (args.getString("email_address") == null) {
            errors.add("email_address is required");
        }

        int maxLimit = properties.getFetch().getMaxLimit();
        Integer limit = null;
        try {
            limit = integer(args, "limit", properties.getFetch().getDefaultLimit());
            if (limit <= 0 || limit > maxLimit) {
                errors.add("limit must be between 1 and " + maxLimit);
            }
        } catch (MailBridgeException e) {
            errors.add(e.getMessage());
        }

        Object reverse = args.get("reverse_order");
        if (reverse != null && !(reverse instanceof Boolean)) {
            errors.add("reverse_order must be a boolean value");
        }

        LocalDateTime start = date(args, "start_date", errors);
        LocalDateTime end = date(args, "end_date", errors);
        if (start != null && end != null && start.isAfter(end)) {
            errors.add("start_date must be before end_date");
        }

        if (!errors.isEmpty()) {
            throw MailBridgeException.validation(String.join("; ", errors));
        }

        String folder = args.getString("folder");
        return FetchFilter.builder()
                .folder(folder == null ? "INBOX" : folder)
                .dateRange(DateRange.of(start, end, properties.getZoneOffset()))
                .limit(limit)
                .startId(args.getString("start_uid"))
                .reverse(Boolean.TRUE.equals(reverse))
                .build();
    }

    SearchRequest searchRequest(ToolArguments args) {
        List<String> errors = new ArrayList<>();
        if (args.getString("email_address") == null) {
            errors.add("email_address is required");
        }
        String keywords = args.getString("keywords");
        if (keywords == null) {
            errors.add("keywords must not be empty");
        }

        int maxPageSize = properties.getSearch().getMaxPageSize();
        Integer pageSize = null;
        try {
            pageSize = integer(args, "page_size", properties.getSearch().getDefaultPageSize());
            if (pageSize <= 0 || pageSize > maxPageSize) {
                errors.add("page_size must be between 1 and " + maxPageSize);
            }
        } catch (MailBridgeException e) {
            errors.add(e.getMessage());
        }

        SearchField field = null;
        try {
            field = SearchField.from(args.getString("search_type"));
        } catch (MailBridgeException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw MailBridgeException.validation(String.join("; ", errors));
        }

        String folder = args.getString("folder");
        return SearchRequest.builder()
                .keywords(keywords)
                .field(field)
                .pageSize(pageSize)
                .lastId(args.getString("last_uid"))
                .folder(folder == null ? "INBOX" : folder)
                .build();
    }

    /**
     * Store attachments of each message in order; a failing message keeps its
     * attachments as failed records
     */
    private List<MessageView> materialize(AccountSettings account, List<MailMessage> messages) {
        List<MessageView> views = new ArrayList<>(messages.size());
        for (MailMessage message : messages) {
            if (!message.hasAttachments()) {
                views.add(MessageView.of(message));
                continue;
            }
            try {
                List<StoredAttachment> stored = storageService.download(
                        account.getAddress(), message.getId(), message.getAttachments());
                views.add(MessageView.withStored(message, stored));
            } catch (MailBridgeException e) {
                log.error("Failed to download attachments for email {}: {}", message.getId(), e.getMessage());
                List<StoredAttachment> failed = message.getAttachments().stream()
                        .map(ref -> StoredAttachment.failed(ref, e.getMessage()))
                        .toList();
                views.add(MessageView.withStored(message, failed));
            }
        }
        return views;
    }

    private Mono<ToolResponse> execute(String operation, ToolArguments args, Function<String, ToolResponse> action) {
        String requestId = operation + "_" + OffsetDateTime.now(properties.getZoneOffset()).format(REQUEST_ID_FORMAT);
        log.info("[{}] Request received: {}", requestId, args.masked());

        return Mono.fromCallable(() -> action.apply(requestId))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(response -> counter(operation, ToolResponse.SUCCESS).increment())
                .onErrorResume(e -> {
                    counter(operation, ToolResponse.ERROR).increment();
                    return Mono.just(error(requestId, e));
                });
    }

    private ToolResponse success(String requestId, String message, Object data) {
        return ToolResponse.builder()
                .status(ToolResponse.SUCCESS)
                .message(message)
                .data(data)
                .requestId(requestId)
                .timestamp(now())
                .build();
    }

    private ToolResponse error(String requestId, Throwable e) {
        ErrorKind kind = null;
        if (e instanceof MailBridgeException mbe) {
            kind = mbe.getKind();
            log.warn("[{}] {}: {}", requestId, kind, e.getMessage());
        } else {
            log.error("[{}] Unexpected failure", requestId, e);
        }
        return ToolResponse.builder()
                .status(ToolResponse.ERROR)
                .message(e.getMessage())
                .errorKind(kind)
                .errorType(e.getClass().getSimpleName())
                .requestId(requestId)
                .timestamp(now())
                .build();
    }

    private Counter counter(String operation, String outcome) {
        return Counter.builder("mailbridge.tool.invocations")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    private static String requireMessageId(ToolArguments args) {
        String messageId = args.getString("email_uid");
        if (messageId == null) {
            throw MailBridgeException.validation("email_uid is required");
        }
        return messageId;
    }

    private static int integer(ToolArguments args, String key, int defaultValue) {
        Object value = args.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw MailBridgeException.validation(key + " must be a valid integer");
        }
    }

    private LocalDateTime date(ToolArguments args, String key, List<String> errors) {
        String value = args.getString(key);
        if (value == null) {
            return null;
        }
        LocalDateTime parsed = DateParser.parse(value, properties.getZoneOffset());
        if (parsed == null) {
            errors.add(key + " format is invalid");
        }
        return parsed;
    }

    private String now() {
        return OffsetDateTime.now(properties.getZoneOffset()).toString();
    }
}
