package com.mailbridge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.AttachmentListing;
import com.mailbridge.domain.AttachmentMetadataDocument;
import com.mailbridge.domain.AttachmentRef;
import com.mailbridge.domain.DownloadStatus;
import com.mailbridge.domain.ExtractionLogDocument;
import com.mailbridge.domain.StorageStats;
import com.mailbridge.domain.StoredAttachment;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.util.StorageUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Local attachment storage
 * Layout: basePath/{accountFolder}/{messageId}/{safeFilename}
 * - re-downloading identical content is a no-op
 * - different content under a taken name goes to name_1.ext, name_2.ext, ...
 * - one failing attachment does not stop its siblings
 *
 * Not safe for overlapping requests on the same message: two concurrent
 * downloads may pick the same free name.
 */
@Slf4j
@Service
public class AttachmentStorageService {

    private final MailBridgeProperties properties;
    private final ArchiveService archiveService;
    private final ObjectMapper objectMapper;
    private final Counter storedCounter;
    private final Counter failedCounter;

    public AttachmentStorageService(MailBridgeProperties properties, ArchiveService archiveService,
                                    ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.archiveService = archiveService;
        this.objectMapper = objectMapper;
        this.storedCounter = Counter.builder("mailbridge.attachments.stored")
                .description("Attachments written to local storage")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("mailbridge.attachments.failed")
                .description("Attachments that could not be stored")
                .register(meterRegistry);
    }

    public Path basePath() {
        return Path.of(properties.getStorage().getBasePath());
    }

    public Path messageDir(String account, String messageId) {
        return basePath()
                .resolve(StorageUtil.accountFolder(account))
                .resolve(StorageUtil.sanitizeFilename(messageId));
    }

    /**
     * Store all attachments of one message and write attachments.json.
     * Archives are extracted afterwards when auto-extract is on and a new file was written.
     */
    public List<StoredAttachment> download(String account, String messageId, List<AttachmentRef> refs) {
        if (refs == null || refs.isEmpty()) {
            return List.of();
        }
        Path dir = messageDir(account, messageId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new MailBridgeException(ErrorKind.ATTACHMENT_FAILURE,
                    "Failed to create attachment directory " + dir + ": " + e.getMessage(), e);
        }

        String downloadTime = now();
        List<StoredAttachment> results = new ArrayList<>();
        for (AttachmentRef ref : refs) {
            results.add(store(dir, ref, downloadTime));
        }

        long successful = results.stream().filter(r -> r.getStatus().isAvailable()).count();
        boolean newlyStored = results.stream().anyMatch(r -> r.getStatus() == DownloadStatus.SUCCESS);
        writeMetadata(dir, AttachmentMetadataDocument.builder()
                .account(account)
                .messageId(messageId)
                .downloadTime(downloadTime)
                .totalAttachments(results.size())
                .successfulDownloads((int) successful)
                .attachments(results)
                .build());
        log.info("Stored {}/{} attachments of message {} for {}", successful, results.size(), messageId, account);

        if (newlyStored && properties.getStorage().isAutoExtract()) {
            try {
                archiveService.processDirectory(dir);
            } catch (MailBridgeException e) {
                log.warn("Archive extraction failed for {}: {}", dir, e.getMessage());
            }
        }
        return results;
    }

    /**
     * Resolve a stored file by exact name, sanitized name, metadata lookup,
     * then stem prefix. First match wins.
     */
    public Optional<byte[]> read(String account, String messageId, String filename) {
        Path dir = messageDir(account, messageId);
        if (!Files.isDirectory(dir) || filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        return resolve(dir, filename).map(path -> {
            try {
                return Files.readAllBytes(path);
            } catch (IOException e) {
                throw new MailBridgeException(ErrorKind.ATTACHMENT_FAILURE,
                        "Failed to read attachment " + path.getFileName() + ": " + e.getMessage(), e);
            }
        });
    }

    public Optional<AttachmentMetadataDocument> getMetadata(String account, String messageId) {
        return readMetadata(messageDir(account, messageId));
    }

    /**
     * All stored files of a message, extracted ones included, sidecars excluded
     */
    public AttachmentListing list(String account, String messageId) {
        Path dir = messageDir(account, messageId);
        List<String> files = new ArrayList<>();
        List<String> directories = new ArrayList<>();
        ExtractionLogDocument extraction = null;

        if (Files.isDirectory(dir)) {
            try (Stream<Path> walk = Files.walk(dir)) {
                for (Path path : walk.filter(p -> !p.equals(dir)).toList()) {
                    String relative = dir.relativize(path).toString().replace('\\', '/');
                    if (Files.isDirectory(path)) {
                        directories.add(relative);
                    } else if (!StorageUtil.isSidecar(path)) {
                        files.add(relative);
                    }
                }
            } catch (IOException e) {
                throw new MailBridgeException(ErrorKind.ATTACHMENT_FAILURE,
                        "Failed to list " + dir + ": " + e.getMessage(), e);
            }
            extraction = readExtractionLog(dir.resolve(StorageUtil.EXTRACTION_LOG_FILE));
        }
        files.sort(null);
        directories.sort(null);

        return AttachmentListing.builder()
                .account(account)
                .messageId(messageId)
                .path(dir.toString())
                .files(files)
                .directories(directories)
                .hierarchical(!directories.isEmpty())
                .count(files.size())
                .extractionRecord(extraction)
                .build();
    }

    /**
     * Remove message directories last modified more than days ago
     *
     * @return number of directories removed
     */
    public int cleanup(int days) {
        if (days < 0) {
            throw MailBridgeException.validation("days must be >= 0, got " + days);
        }
        Path base = basePath();
        if (!Files.isDirectory(base)) {
            return 0;
        }
        FileTime cutoff = FileTime.from(Instant.now().minus(Duration.ofDays(days)));
        int removed = 0;
        for (Path accountDir : children(base)) {
            for (Path messageDir : children(accountDir)) {
                try {
                    if (Files.getLastModifiedTime(messageDir).compareTo(cutoff) < 0) {
                        StorageUtil.deleteRecursively(messageDir);
                        removed++;
                        log.info("Removed old attachment directory {}", messageDir);
                    }
                } catch (IOException e) {
                    log.warn("Failed to clean up {}: {}", messageDir, e.getMessage());
                }
            }
        }
        log.info("Cleanup removed {} directories older than {} days", removed, days);
        return removed;
    }

    public StorageStats getStorageStats() {
        Path base = basePath();
        long totalBytes = 0;
        long totalFiles = 0;
        int accounts = 0;
        int messages = 0;

        if (Files.isDirectory(base)) {
            List<Path> accountDirs = children(base);
            accounts = accountDirs.size();
            for (Path accountDir : accountDirs) {
                messages += children(accountDir).size();
            }
            try (Stream<Path> walk = Files.walk(base)) {
                for (Path file : walk.filter(Files::isRegularFile).toList()) {
                    totalBytes += Files.size(file);
                    totalFiles++;
                }
            } catch (IOException e) {
                throw new MailBridgeException(ErrorKind.ATTACHMENT_FAILURE,
                        "Failed to compute storage statistics: " + e.getMessage(), e);
            }
        }

        return StorageStats.builder()
                .totalSizeBytes(totalBytes)
                .totalSizeMb(Math.round(totalBytes / (1024.0 * 1024.0) * 100.0) / 100.0)
                .totalFiles(totalFiles)
                .accounts(accounts)
                .messages(messages)
                .basePath(base.toAbsolutePath().toString())
                .build();
    }

    private StoredAttachment store(Path dir, AttachmentRef ref, String downloadTime) {
        String desired = StorageUtil.sanitizeFilename(ref.getFilename());
        try {
            byte[] payload = ref.readPayload();

            String name = desired;
            DownloadStatus status = DownloadStatus.SUCCESS;
            int counter = 0;
            while (Files.exists(dir.resolve(name))) {
                if (StorageUtil.sameContent(dir.resolve(name), payload)) {
                    status = DownloadStatus.SKIPPED_EXISTING;
                    break;
                }
                counter++;
                name = StorageUtil.numberedName(desired, counter);
            }

            Path target = dir.resolve(name);
            if (status == DownloadStatus.SUCCESS) {
                Files.write(target, payload);
                storedCounter.increment();
                log.debug("Saved attachment {} ({} bytes)", target, payload.length);
            } else {
                log.debug("Attachment {} already stored, skipping", target);
            }

            return StoredAttachment.builder()
                    .filename(ref.getFilename())
                    .originalFilename(ref.getOriginalFilename())
                    .safeFilename(name)
                    .contentType(ref.getContentType())
                    .size(payload.length)
                    .localPath(target.toAbsolutePath().toString())
                    .status(status)
                    .downloadTime(downloadTime)
                    .build();
        } catch (MessagingException | IOException e) {
            failedCounter.increment();
            log.warn("Failed to store attachment {}: {}", ref.getFilename(), e.getMessage());
            StoredAttachment failed = StoredAttachment.failed(ref, e.getMessage());
            failed.setSafeFilename(desired);
            failed.setDownloadTime(downloadTime);
            return failed;
        }
    }

    private Optional<Path> resolve(Path dir, String filename) {
        Optional<Path> exact = storedFile(dir, filename);
        if (exact.isPresent()) {
            return exact;
        }
        Optional<Path> sanitized = storedFile(dir, StorageUtil.sanitizeFilename(filename));
        if (sanitized.isPresent()) {
            return sanitized;
        }

        Optional<AttachmentMetadataDocument> metadata = readMetadata(dir);
        if (metadata.isPresent()) {
            for (StoredAttachment attachment : metadata.get().getAttachments()) {
                boolean named = filename.equals(attachment.getFilename())
                        || filename.equals(attachment.getOriginalFilename())
                        || filename.equals(attachment.getSafeFilename());
                if (named && attachment.getLocalPath() != null) {
                    Path local = Path.of(attachment.getLocalPath());
                    if (Files.isRegularFile(local)) {
                        return Optional.of(local);
                    }
                }
            }
        }

        String stem = filename.contains(".") ? filename.substring(0, filename.indexOf('.')) : filename;
        if (stem.isEmpty()) {
            return Optional.empty();
        }
        try (Stream<Path> list = Files.list(dir)) {
            return list.filter(Files::isRegularFile)
                    .filter(p -> !StorageUtil.isSidecar(p))
                    .sorted()
                    .filter(p -> p.getFileName().toString().startsWith(stem))
                    .findFirst();
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> storedFile(Path dir, String name) {
        Path candidate = dir.resolve(name).normalize();
        if (StorageUtil.isInside(dir, candidate) && Files.isRegularFile(candidate) && !StorageUtil.isSidecar(candidate)) {
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private Optional<AttachmentMetadataDocument> readMetadata(Path dir) {
        Path file = dir.resolve(StorageUtil.METADATA_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), AttachmentMetadataDocument.class));
        } catch (IOException e) {
            log.warn("Unreadable metadata file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private ExtractionLogDocument readExtractionLog(Path file) {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return objectMapper.readValue(file.toFile(), ExtractionLogDocument.class);
        } catch (IOException e) {
            log.warn("Unreadable extraction log {}: {}", file, e.getMessage());
            return null;
        }
    }

    private void writeMetadata(Path dir, AttachmentMetadataDocument document) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(dir.resolve(StorageUtil.METADATA_FILE).toFile(), document);
        } catch (IOException e) {
            log.error("Failed to write attachment metadata in {}", dir, e);
        }
    }

    private static List<Path> children(Path dir) {
        try (Stream<Path> list = Files.list(dir)) {
            return list.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private String now() {
        return OffsetDateTime.now(properties.getZoneOffset()).toString();
    }
}
