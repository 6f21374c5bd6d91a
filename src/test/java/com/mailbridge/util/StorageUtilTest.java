package com.mailbridge.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * StorageUtil unit tests
 */
class StorageUtilTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Unsafe characters become underscores")
    void testSanitizeFilename() {
        assertThat(StorageUtil.sanitizeFilename("a<b>c:d.txt")).isEqualTo("a_b_c_d.txt");
        assertThat(StorageUtil.sanitizeFilename("dir/evil\\name.pdf")).isEqualTo("dir_evil_name.pdf");
        assertThat(StorageUtil.sanitizeFilename("..hidden.. ")).isEqualTo("hidden");
    }

    @Test
    @DisplayName("Empty or missing filename falls back to unnamed_file")
    void testSanitizeFilename_Empty() {
        assertThat(StorageUtil.sanitizeFilename("")).isEqualTo("unnamed_file");
        assertThat(StorageUtil.sanitizeFilename(" . ")).isEqualTo("unnamed_file");
        assertThat(StorageUtil.sanitizeFilename(null)).isEqualTo("unnamed_file");
    }

    @Test
    @DisplayName("Long filenames are cut to 255 characters keeping the extension")
    void testSanitizeFilename_Long() {
        String safe = StorageUtil.sanitizeFilename("a".repeat(300) + ".pdf");

        assertThat(safe).hasSize(255);
        assertThat(safe).endsWith(".pdf");
    }

    @Test
    @DisplayName("Member paths lose traversal and absolute components")
    void testSanitizeRelativePath() {
        assertThat(StorageUtil.sanitizeRelativePath("../../etc/passwd")).isEqualTo("etc/passwd");
        assertThat(StorageUtil.sanitizeRelativePath("/abs/file.txt")).isEqualTo("abs/file.txt");
        assertThat(StorageUtil.sanitizeRelativePath("a\\b\\..\\c.txt")).isEqualTo("a/b/c.txt");
        assertThat(StorageUtil.sanitizeRelativePath("./.")).isEmpty();
    }

    @Test
    @DisplayName("Account folder: '@' -> '-', '.' -> '_'")
    void testAccountFolder() {
        assertThat(StorageUtil.accountFolder("john.doe@example.com")).isEqualTo("john_doe-example_com");
        assertThat(StorageUtil.accountFolder(null)).isEqualTo("unknown");
    }

    @Test
    @DisplayName("Numbered name puts the counter before the extension")
    void testNumberedName() {
        assertThat(StorageUtil.numberedName("report.pdf", 1)).isEqualTo("report_1.pdf");
        assertThat(StorageUtil.numberedName("archive.tar.gz", 2)).isEqualTo("archive.tar_2.gz");
        assertThat(StorageUtil.numberedName("README", 3)).isEqualTo("README_3");
        assertThat(StorageUtil.numberedName("docs/a.txt", 1)).isEqualTo("docs/a_1.txt");
    }

    @Test
    @DisplayName("Content comparison matches identical bytes only")
    void testSameContent() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "alpha");

        assertThat(StorageUtil.sameContent(file, "alpha".getBytes(StandardCharsets.UTF_8))).isTrue();
        assertThat(StorageUtil.sameContent(file, "beta".getBytes(StandardCharsets.UTF_8))).isFalse();
        assertThat(StorageUtil.sameContent(tempDir, new byte[0])).isFalse();
        assertThat(StorageUtil.sameContent(tempDir.resolve("missing"), new byte[0])).isFalse();
    }

    @Test
    @DisplayName("Containment check rejects paths outside the directory")
    void testIsInside() {
        assertThat(StorageUtil.isInside(tempDir, tempDir.resolve("a/b.txt"))).isTrue();
        assertThat(StorageUtil.isInside(tempDir, tempDir.resolve("../escape.txt"))).isFalse();
        assertThat(StorageUtil.isInside(tempDir, tempDir)).isFalse();
    }

    @Test
    @DisplayName("Sidecar files are recognized by name")
    void testIsSidecar() {
        assertThat(StorageUtil.isSidecar(tempDir.resolve("attachments.json"))).isTrue();
        assertThat(StorageUtil.isSidecar(tempDir.resolve("extraction_log.json"))).isTrue();
        assertThat(StorageUtil.isSidecar(tempDir.resolve("data.json"))).isFalse();
    }
}
