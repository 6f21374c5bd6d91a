package com.mailbridge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.ExtractionLogDocument;
import com.mailbridge.domain.ExtractionRecord;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import com.mailbridge.util.StorageUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Archive extraction for stored attachments
 * - member paths are sanitized and confined to the target directory
 * - colliding names get a _n suffix, nothing is overwritten
 * - recursive extraction runs in rounds until no unprocessed archive is left
 *   or the depth limit is reached
 */
@Slf4j
@Service
public class ArchiveService {

    private static final String DEFAULT_SINGLE_NAME = "extracted_file";

    private final MailBridgeProperties properties;
    private final ObjectMapper objectMapper;
    private final Counter archivesExtractedCounter;
    private final Counter archiveFailureCounter;

    public ArchiveService(MailBridgeProperties properties, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.archivesExtractedCounter = Counter.builder("mailbridge.archives.extracted")
                .description("Archives successfully extracted")
                .register(meterRegistry);
        this.archiveFailureCounter = Counter.builder("mailbridge.archives.failed")
                .description("Archives that failed to extract")
                .register(meterRegistry);
    }

    /**
     * Extract one archive into targetDir
     *
     * @return the files written
     * @throws MailBridgeException ARCHIVE_FAILURE for unsupported or corrupt archives
     */
    public List<Path> extractArchive(Path archive, Path targetDir) {
        List<Path> written = new ArrayList<>();
        extractInto(archive, targetDir, written);
        return written;
    }

    /**
     * Extract archives found under dir in rounds; each archive is extracted next
     * to itself at most once per call
     */
    public ExtractionRecord extractRecursively(Path dir, int maxDepth) {
        ExtractionRecord record = new ExtractionRecord();
        Set<Path> processed = new HashSet<>();

        int depth = 0;
        while (depth < maxDepth) {
            List<Path> archives = findUnprocessed(dir, processed);
            if (archives.isEmpty()) {
                log.info("No more archives found after {} rounds", depth);
                break;
            }

            ExtractionRecord.Round round = record.startRound(depth + 1, archives.size());
            for (Path archive : archives) {
                processed.add(archive.toAbsolutePath().normalize());
                String archiveName = relative(dir, archive);

                ArchiveFormat format = ArchiveFormat.detect(archive.getFileName().toString());
                if (format != null && !format.isSupported()) {
                    log.warn("Archive type {} requires an external decoder, skipping: {}", format, archiveName);
                    round.getSkipped().add(archiveName);
                    continue;
                }

                Path targetDir = archive.getParent();
                ExtractionRecord.ArchiveOutcome outcome = new ExtractionRecord.ArchiveOutcome();
                outcome.setArchive(archiveName);
                outcome.setExtractedTo(relative(dir, targetDir));
                List<Path> written = new ArrayList<>();
                try {
                    extractInto(archive, targetDir, written);
                    log.info("Extracted {} files from {}", written.size(), archiveName);
                } catch (MailBridgeException e) {
                    String error = "Failed to extract " + archiveName + ": " + e.getMessage();
                    log.warn("{} ({} files written before the failure)", error, written.size());
                    outcome.setError(error);
                    round.getErrors().add(error);
                    record.getErrors().add(error);
                }

                if (outcome.getError() == null || !written.isEmpty()) {
                    written.forEach(f -> outcome.getFiles().add(relative(dir, f)));
                    round.getExtracted().add(outcome);
                    record.setTotalExtracted(record.getTotalExtracted() + written.size());
                }
            }
            depth++;
        }

        if (depth >= maxDepth && !findUnprocessed(dir, processed).isEmpty()) {
            String warning = "Reached maximum extraction depth (" + maxDepth + "), unprocessed archives remain";
            log.warn(warning);
            record.getErrors().add(warning);
            record.setDepthExceeded(true);
        }
        return record;
    }

    /**
     * Recursive extraction with the configured depth; the record is written
     * to extraction_log.json inside dir
     */
    public ExtractionRecord processDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw MailBridgeException.validation("Directory does not exist: " + dir);
        }
        log.info("Processing attachments in {}", dir);
        ExtractionRecord record = extractRecursively(dir, properties.getStorage().getMaxExtractionDepth());

        ExtractionLogDocument document = new ExtractionLogDocument(
                dir.getFileName().toString(), OffsetDateTime.now(properties.getZoneOffset()).toString(), record);
        try {
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(dir.resolve(StorageUtil.EXTRACTION_LOG_FILE).toFile(), document);
        } catch (IOException e) {
            log.error("Failed to write extraction log in {}", dir, e);
        }
        return record;
    }

    /**
     * Files are added to written as they land on disk, so a caller still sees
     * them when extraction fails partway
     */
    private void extractInto(Path archive, Path targetDir, List<Path> written) {
        ArchiveFormat format = ArchiveFormat.detect(archive.getFileName().toString());
        if (format == null || !format.isSupported()) {
            throw new MailBridgeException(ErrorKind.ARCHIVE_FAILURE,
                    "Unsupported archive type: " + archive.getFileName());
        }
        log.info("Extracting {} archive: {}", format, archive);
        try {
            Files.createDirectories(targetDir);
            switch (format) {
                case ZIP, TAR, TAR_GZ, TAR_BZ2, TAR_XZ -> extractEntries(format, archive, targetDir, written);
                case SEVEN_Z -> extractSevenZ(archive, targetDir, written);
                case GZ, BZ2, XZ -> extractSingle(format, archive, targetDir, written);
                case RAR -> { }
            }
            archivesExtractedCounter.increment();
        } catch (IOException | RuntimeException e) {
            archiveFailureCounter.increment();
            throw new MailBridgeException(ErrorKind.ARCHIVE_FAILURE,
                    "Failed to extract " + archive.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private void extractEntries(ArchiveFormat format, Path archive, Path targetDir, List<Path> written) throws IOException {
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
             ArchiveInputStream<? extends ArchiveEntry> entries = openEntries(format, raw)) {
            ArchiveEntry entry;
            while ((entry = entries.getNextEntry()) != null) {
                if (!isRegularFile(entry)) {
                    continue;
                }
                if (!entries.canReadEntryData(entry)) {
                    log.warn("Cannot read entry {} in {}, skipping", entry.getName(), archive.getFileName());
                    continue;
                }
                writeMember(targetDir, entry.getName(), entries, written);
            }
        }
    }

    private ArchiveInputStream<? extends ArchiveEntry> openEntries(ArchiveFormat format, InputStream raw) throws IOException {
        return switch (format) {
            case ZIP -> new ZipArchiveInputStream(raw);
            case TAR -> new TarArchiveInputStream(raw);
            case TAR_GZ -> new TarArchiveInputStream(new GzipCompressorInputStream(raw));
            case TAR_BZ2 -> new TarArchiveInputStream(new BZip2CompressorInputStream(raw));
            case TAR_XZ -> new TarArchiveInputStream(new XZCompressorInputStream(raw));
            default -> throw new IllegalArgumentException("Not an entry archive: " + format);
        };
    }

    private void extractSevenZ(Path archive, Path targetDir, List<Path> written) throws IOException {
        try (SevenZFile sevenZ = SevenZFile.builder().setFile(archive.toFile()).get()) {
            SevenZArchiveEntry entry;
            while ((entry = sevenZ.getNextEntry()) != null) {
                if (entry.isDirectory() || !entry.hasStream()) {
                    continue;
                }
                try (InputStream in = sevenZ.getInputStream(entry)) {
                    writeMember(targetDir, entry.getName(), in, written);
                }
            }
        }
    }

    private void extractSingle(ArchiveFormat format, Path archive, Path targetDir, List<Path> written) throws IOException {
        String outputName = StorageUtil.sanitizeFilename(format.stripSuffix(archive.getFileName().toString()));
        if (outputName.isEmpty() || "unnamed_file".equals(outputName)) {
            outputName = DEFAULT_SINGLE_NAME;
        }
        byte[] payload;
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
             InputStream in = switch (format) {
                 case GZ -> new GzipCompressorInputStream(raw);
                 case BZ2 -> new BZip2CompressorInputStream(raw);
                 default -> new XZCompressorInputStream(raw);
             }) {
            payload = in.readAllBytes();
        }
        Path target = freeTarget(targetDir, outputName, payload);
        if (target == null) {
            log.debug("{} already extracted with the same content, skipping", outputName);
            return;
        }
        Files.write(target, payload);
        written.add(target);
        log.debug("Extracted: {} -> {}", archive, target);
    }

    /**
     * Write one member under targetDir. Members whose path is empty after sanitizing,
     * would escape targetDir, or match an existing file byte for byte are skipped.
     */
    private void writeMember(Path targetDir, String memberName, InputStream in, List<Path> written) throws IOException {
        String safePath = StorageUtil.sanitizeRelativePath(memberName);
        if (safePath.isEmpty()) {
            log.warn("Skipping archive member with unusable path: {}", memberName);
            return;
        }
        if (!StorageUtil.isInside(targetDir, targetDir.resolve(safePath))) {
            log.warn("Skipping archive member outside target directory: {}", memberName);
            return;
        }
        byte[] payload = in.readAllBytes();
        Path target = freeTarget(targetDir, safePath, payload);
        if (target == null) {
            log.debug("Member {} already extracted with the same content, skipping", memberName);
            return;
        }
        Files.createDirectories(target.getParent());
        Files.write(target, payload);
        written.add(target);
        log.debug("Extracted member {} -> {}", memberName, target);
    }

    /**
     * First free name for payload (name, then stem_N.ext); null when a file with
     * identical bytes already occupies one of them
     */
    private static Path freeTarget(Path targetDir, String name, byte[] payload) {
        String candidate = name;
        int counter = 0;
        while (Files.exists(targetDir.resolve(candidate))) {
            if (StorageUtil.sameContent(targetDir.resolve(candidate), payload)) {
                return null;
            }
            counter++;
            candidate = StorageUtil.numberedName(name, counter);
        }
        return targetDir.resolve(candidate).normalize();
    }

    private static boolean isRegularFile(ArchiveEntry entry) {
        if (entry.isDirectory()) {
            return false;
        }
        if (entry instanceof TarArchiveEntry tar) {
            return tar.isFile();
        }
        if (entry instanceof ZipArchiveEntry zip) {
            return !zip.isUnixSymlink();
        }
        return true;
    }

    private static List<Path> findUnprocessed(Path dir, Set<Path> processed) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> ArchiveFormat.detect(p.getFileName().toString()) != null)
                    .filter(p -> !processed.contains(p.toAbsolutePath().normalize()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new MailBridgeException(ErrorKind.ARCHIVE_FAILURE, "Failed to scan " + dir + ": " + e.getMessage(), e);
        }
    }

    private static String relative(Path base, Path path) {
        String rel = base.toAbsolutePath().normalize().relativize(path.toAbsolutePath().normalize()).toString();
        return rel.isEmpty() ? "." : rel.replace('\\', '/');
    }
}
