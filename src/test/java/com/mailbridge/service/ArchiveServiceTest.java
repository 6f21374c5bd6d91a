package com.mailbridge.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.config.MailBridgeProperties;
import com.mailbridge.domain.ExtractionRecord;
import com.mailbridge.exception.ErrorKind;
import com.mailbridge.exception.MailBridgeException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZOutputFile;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * ArchiveService tests on archives built in a temp directory
 */
class ArchiveServiceTest {

    @TempDir
    Path tempDir;

    private MailBridgeProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ArchiveService archiveService;

    @BeforeEach
    void setUp() {
        properties = new MailBridgeProperties();
        meterRegistry = new SimpleMeterRegistry();
        archiveService = new ArchiveService(properties, new ObjectMapper(), meterRegistry);
    }

    @Test
    @DisplayName("Zip members are extracted with their directory structure")
    void testExtractZip() throws Exception {
        Path archive = tempDir.resolve("bundle.zip");
        Files.write(archive, zip(Map.of("a.txt", "alpha", "docs/b.txt", "beta")));

        List<Path> files = archiveService.extractArchive(archive, tempDir);

        assertThat(files).hasSize(2);
        assertThat(Files.readString(tempDir.resolve("a.txt"))).isEqualTo("alpha");
        assertThat(Files.readString(tempDir.resolve("docs/b.txt"))).isEqualTo("beta");
        assertThat(meterRegistry.counter("mailbridge.archives.extracted").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Traversal and absolute member paths stay inside the target")
    void testPathTraversal() throws Exception {
        Path target = Files.createDirectories(tempDir.resolve("target"));
        Path archive = tempDir.resolve("evil.zip");
        Map<String, String> members = new LinkedHashMap<>();
        members.put("../../etc/passwd", "root");
        members.put("/abs/x.txt", "abs");
        Files.write(archive, zip(members));

        List<Path> files = archiveService.extractArchive(archive, target);

        assertThat(files).allSatisfy(f -> assertThat(f.toAbsolutePath().normalize())
                .startsWith(target.toAbsolutePath().normalize()));
        assertThat(Files.readString(target.resolve("etc/passwd"))).isEqualTo("root");
        assertThat(Files.readString(target.resolve("abs/x.txt"))).isEqualTo("abs");
        assertThat(tempDir.resolve("etc")).doesNotExist();
    }

    @Test
    @DisplayName("Tar.gz members are extracted")
    void testExtractTarGz() throws Exception {
        Path archive = tempDir.resolve("logs.tar.gz");
        Files.write(archive, gzip(tar(Map.of("logs/app.log", "started"))));

        List<Path> files = archiveService.extractArchive(archive, tempDir);

        assertThat(files).hasSize(1);
        assertThat(Files.readString(tempDir.resolve("logs/app.log"))).isEqualTo("started");
    }

    @Test
    @DisplayName("A single gzip stream is written under the name without .gz")
    void testExtractSingleGzip() throws Exception {
        Path archive = tempDir.resolve("notes.txt.gz");
        Files.write(archive, gzip("hello".getBytes(StandardCharsets.UTF_8)));

        List<Path> files = archiveService.extractArchive(archive, tempDir);

        assertThat(files).containsExactly(tempDir.resolve("notes.txt"));
        assertThat(Files.readString(tempDir.resolve("notes.txt"))).isEqualTo("hello");
    }

    @Test
    @DisplayName(".tgz, tar.bz2 and tar.xz members are extracted")
    void testExtractCompressedTars() throws Exception {
        Path tgz = tempDir.resolve("a.tgz");
        Files.write(tgz, gzip(tar(Map.of("gz/one.txt", "one"))));
        Path bz2 = tempDir.resolve("b.tar.bz2");
        Files.write(bz2, bzip2(tar(Map.of("bz/two.txt", "two"))));
        Path xz = tempDir.resolve("c.tar.xz");
        Files.write(xz, xz(tar(Map.of("xz/three.txt", "three"))));

        assertThat(archiveService.extractArchive(tgz, tempDir)).containsExactly(tempDir.resolve("gz/one.txt"));
        assertThat(archiveService.extractArchive(bz2, tempDir)).containsExactly(tempDir.resolve("bz/two.txt"));
        assertThat(archiveService.extractArchive(xz, tempDir)).containsExactly(tempDir.resolve("xz/three.txt"));
        assertThat(Files.readString(tempDir.resolve("xz/three.txt"))).isEqualTo("three");
        assertThat(meterRegistry.counter("mailbridge.archives.extracted").count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Single bzip2 and xz streams drop their suffix")
    void testExtractSingleBzip2AndXz() throws Exception {
        Path bz2 = tempDir.resolve("data.csv.bz2");
        Files.write(bz2, bzip2("a,b".getBytes(StandardCharsets.UTF_8)));
        Path xz = tempDir.resolve("dump.sql.xz");
        Files.write(xz, xz("select 1".getBytes(StandardCharsets.UTF_8)));

        assertThat(archiveService.extractArchive(bz2, tempDir)).containsExactly(tempDir.resolve("data.csv"));
        assertThat(archiveService.extractArchive(xz, tempDir)).containsExactly(tempDir.resolve("dump.sql"));
        assertThat(Files.readString(tempDir.resolve("data.csv"))).isEqualTo("a,b");
        assertThat(Files.readString(tempDir.resolve("dump.sql"))).isEqualTo("select 1");
    }

    @Test
    @DisplayName("7z members are extracted with their directory structure")
    void testExtractSevenZ() throws Exception {
        Path source = Files.writeString(Files.createDirectories(tempDir.resolve("src")).resolve("c.txt"), "gamma");
        Path archive = tempDir.resolve("pack.7z");
        try (SevenZOutputFile out = new SevenZOutputFile(archive.toFile())) {
            SevenZArchiveEntry entry = out.createArchiveEntry(source.toFile(), "docs/c.txt");
            out.putArchiveEntry(entry);
            out.write(Files.readAllBytes(source));
            out.closeArchiveEntry();
        }
        Path target = Files.createDirectories(tempDir.resolve("out"));

        List<Path> files = archiveService.extractArchive(archive, target);

        assertThat(files).containsExactly(target.resolve("docs/c.txt"));
        assertThat(Files.readString(target.resolve("docs/c.txt"))).isEqualTo("gamma");
    }

    @Test
    @DisplayName("Members identical to an existing file are not written again")
    void testIdenticalMemberSkipped() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "alpha");
        Files.write(tempDir.resolve("notes.txt"), "hello".getBytes(StandardCharsets.UTF_8));
        Path zip = tempDir.resolve("bundle.zip");
        Files.write(zip, zip(Map.of("a.txt", "alpha")));
        Path gz = tempDir.resolve("notes.txt.gz");
        Files.write(gz, gzip("hello".getBytes(StandardCharsets.UTF_8)));

        assertThat(archiveService.extractArchive(zip, tempDir)).isEmpty();
        assertThat(archiveService.extractArchive(gz, tempDir)).isEmpty();
        assertThat(tempDir.resolve("a_1.txt")).doesNotExist();
        assertThat(tempDir.resolve("notes_1.txt")).doesNotExist();
    }

    @Test
    @DisplayName("Processing a directory again writes no duplicates")
    void testRepeatedProcessDirectory() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("42"));
        byte[] inner = zip(Map.of("deep.txt", "deep"));
        Files.write(dir.resolve("outer.zip"), zip(Map.of("inner.zip", inner, "a.txt", "alpha")));

        archiveService.processDirectory(dir);
        ExtractionRecord again = archiveService.processDirectory(dir);

        assertThat(again.getTotalExtracted()).isZero();
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactlyInAnyOrder("outer.zip", "inner.zip", "a.txt", "deep.txt", "extraction_log.json");
        }
    }

    @Test
    @DisplayName("Files written before a mid-archive failure are recorded with the error")
    void testPartialFailureRecorded() throws Exception {
        byte[] noise = new byte[64 * 1024];
        new Random(42).nextBytes(noise);
        Map<String, Object> members = new LinkedHashMap<>();
        members.put("a.txt", "alpha");
        members.put("noise.bin", noise);
        byte[] complete = gzip(tar(members));
        Files.write(tempDir.resolve("broken.tar.gz"), Arrays.copyOf(complete, complete.length / 2));

        ExtractionRecord record = archiveService.extractRecursively(tempDir, 1);

        ExtractionRecord.ArchiveOutcome outcome = record.getRounds().get(0).getExtracted().get(0);
        assertThat(outcome.getArchive()).isEqualTo("broken.tar.gz");
        assertThat(outcome.getFiles()).containsExactly("a.txt");
        assertThat(outcome.getError()).contains("broken.tar.gz");
        assertThat(record.getErrors()).hasSize(1);
        assertThat(record.getTotalExtracted()).isEqualTo(1);
        assertThat(Files.readString(tempDir.resolve("a.txt"))).isEqualTo("alpha");
    }

    @Test
    @DisplayName("Existing files are never overwritten")
    void testNameCollision() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "original");
        Path archive = tempDir.resolve("bundle.zip");
        Files.write(archive, zip(Map.of("a.txt", "from archive")));

        archiveService.extractArchive(archive, tempDir);

        assertThat(Files.readString(tempDir.resolve("a.txt"))).isEqualTo("original");
        assertThat(Files.readString(tempDir.resolve("a_1.txt"))).isEqualTo("from archive");
    }

    @Test
    @DisplayName("Unsupported and corrupt archives raise archive failures")
    void testExtractFailures() throws Exception {
        Path rar = Files.writeString(tempDir.resolve("x.rar"), "rar");
        Path corrupt = Files.writeString(tempDir.resolve("bad.tar.gz"), "not gzip at all");

        assertThatThrownBy(() -> archiveService.extractArchive(rar, tempDir))
                .isInstanceOf(MailBridgeException.class)
                .hasMessageContaining("Unsupported");
        MailBridgeException error = catchThrowableOfType(
                () -> archiveService.extractArchive(corrupt, tempDir), MailBridgeException.class);
        assertThat(error.getKind()).isEqualTo(ErrorKind.ARCHIVE_FAILURE);
        assertThat(meterRegistry.counter("mailbridge.archives.failed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Nested archives are extracted in successive rounds")
    void testNestedRounds() throws Exception {
        byte[] inner = zip(Map.of("deep.txt", "deep"));
        Files.write(tempDir.resolve("outer.zip"), zip(Map.of("inner.zip", inner)));

        ExtractionRecord record = archiveService.extractRecursively(tempDir, 10);

        assertThat(record.getRounds()).hasSize(2);
        assertThat(record.getRounds().get(0).getExtracted().get(0).getArchive()).isEqualTo("outer.zip");
        assertThat(record.getRounds().get(0).getExtracted().get(0).getExtractedTo()).isEqualTo(".");
        assertThat(record.getRounds().get(1).getExtracted().get(0).getFiles()).containsExactly("deep.txt");
        assertThat(record.getTotalExtracted()).isEqualTo(2);
        assertThat(record.isDepthExceeded()).isFalse();
        assertThat(Files.readString(tempDir.resolve("deep.txt"))).isEqualTo("deep");
    }

    @Test
    @DisplayName("Stopping at the depth limit with archives left is reported")
    void testDepthLimit() throws Exception {
        byte[] inner = zip(Map.of("deep.txt", "deep"));
        Files.write(tempDir.resolve("outer.zip"), zip(Map.of("inner.zip", inner)));

        ExtractionRecord record = archiveService.extractRecursively(tempDir, 1);

        assertThat(record.getRounds()).hasSize(1);
        assertThat(record.isDepthExceeded()).isTrue();
        assertThat(record.getErrors()).anyMatch(e -> e.contains("maximum extraction depth"));
        assertThat(tempDir.resolve("deep.txt")).doesNotExist();
    }

    @Test
    @DisplayName("An archive that contains itself terminates at the depth limit")
    void testSelfContainingArchive() throws Exception {
        byte[] seed = zip(Map.of("seed.txt", "x"));
        Files.write(tempDir.resolve("loop.zip"), zip(Map.of("loop.zip", seed)));

        ExtractionRecord record = archiveService.extractRecursively(tempDir, 3);

        assertThat(record.getRounds()).hasSizeLessThanOrEqualTo(3);
        assertThat(tempDir.resolve("loop_1.zip")).exists();
        assertThat(tempDir.resolve("seed.txt")).exists();
    }

    @Test
    @DisplayName("RAR archives are listed as skipped")
    void testRarSkipped() throws Exception {
        Files.writeString(tempDir.resolve("scan.rar"), "rar");

        ExtractionRecord record = archiveService.extractRecursively(tempDir, 10);

        assertThat(record.getRounds()).hasSize(1);
        assertThat(record.getRounds().get(0).getSkipped()).containsExactly("scan.rar");
        assertThat(record.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("processDirectory writes extraction_log.json")
    void testProcessDirectory() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("42"));
        Files.write(dir.resolve("bundle.zip"), zip(Map.of("a.txt", "alpha")));

        ExtractionRecord record = archiveService.processDirectory(dir);

        assertThat(record.getTotalExtracted()).isEqualTo(1);
        JsonNode log = new ObjectMapper().readTree(dir.resolve("extraction_log.json").toFile());
        assertThat(log.get("messageId").asText()).isEqualTo("42");
        assertThat(log.get("extractionLog").get("totalExtracted").asInt()).isEqualTo(1);
        assertThat(log.get("extractionTime").asText()).isNotBlank();
    }

    @Test
    @DisplayName("processDirectory rejects a missing directory")
    void testProcessMissingDirectory() {
        assertThatThrownBy(() -> archiveService.processDirectory(tempDir.resolve("missing")))
                .isInstanceOf(MailBridgeException.class)
                .hasMessageContaining("does not exist");
    }

    static byte[] zip(Map<String, ?> members) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream out = new ZipArchiveOutputStream(bytes)) {
            for (Map.Entry<String, ?> member : members.entrySet()) {
                out.putArchiveEntry(new ZipArchiveEntry(member.getKey()));
                out.write(content(member.getValue()));
                out.closeArchiveEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static byte[] tar(Map<String, ?> members) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream out = new TarArchiveOutputStream(bytes)) {
            for (Map.Entry<String, ?> member : members.entrySet()) {
                byte[] data = content(member.getValue());
                TarArchiveEntry entry = new TarArchiveEntry(member.getKey());
                entry.setSize(data.length);
                out.putArchiveEntry(entry);
                out.write(data);
                out.closeArchiveEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream out = new GzipCompressorOutputStream(bytes)) {
            out.write(data);
        }
        return bytes.toByteArray();
    }

    private static byte[] bzip2(byte[] data) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream out = new BZip2CompressorOutputStream(bytes)) {
            out.write(data);
        }
        return bytes.toByteArray();
    }

    private static byte[] xz(byte[] data) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream out = new XZCompressorOutputStream(bytes)) {
            out.write(data);
        }
        return bytes.toByteArray();
    }

    private static byte[] content(Object value) {
        return value instanceof byte[] raw ? raw : value.toString().getBytes(StandardCharsets.UTF_8);
    }
}
