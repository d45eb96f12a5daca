package com.example.rangedownloader.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileUtilsTest {

    @TempDir
    Path dir;

    @Test
    void extractsNameFromUrlPath() {
        assertThat(FileUtils.extractFileNameFromUrl("http://example.com/a/b/file.zip")).isEqualTo("file.zip");
        assertThat(FileUtils.extractFileNameFromUrl("http://example.com/file.zip?token=1#x")).isEqualTo("file.zip");
        assertThat(FileUtils.extractFileNameFromUrl("http://example.com/%E6%96%87%E4%BB%B6.txt"))
                .isEqualTo("文件.txt");
    }

    @Test
    void fallsBackToDefaultName() {
        assertThat(FileUtils.extractFileNameFromUrl("http://example.com")).isEqualTo(FileUtils.DEFAULT_FILE_NAME);
        assertThat(FileUtils.extractFileNameFromUrl("http://example.com/")).isEqualTo(FileUtils.DEFAULT_FILE_NAME);
    }

    @Test
    void readsContentDisposition() {
        assertThat(FileUtils.fileNameFromDisposition("attachment; filename=\"report.pdf\"")).isEqualTo("report.pdf");
        assertThat(FileUtils.fileNameFromDisposition(
                "attachment; filename=\"fallback.pdf\"; filename*=UTF-8''%E6%8A%A5%E5%91%8A.pdf"))
                .isEqualTo("报告.pdf");
        assertThat(FileUtils.fileNameFromDisposition("inline")).isNull();
        assertThat(FileUtils.fileNameFromDisposition(null)).isNull();
    }

    @Test
    void sanitizeStripsPathsAndIllegalCharacters() {
        assertThat(FileUtils.sanitize("../../etc/passwd")).isEqualTo("passwd");
        assertThat(FileUtils.sanitize("a:b*c?.txt")).isEqualTo("a_b_c_.txt");
        assertThat(FileUtils.sanitize("..")).isEmpty();
    }

    @Test
    void uniqueNameSkipsExistingAndPartialFiles() throws Exception {
        Files.createFile(dir.resolve("test.zip"));
        Files.createFile(dir.resolve("test(1).zip.part"));

        assertThat(FileUtils.getUniqueFileName(dir.toString(), "test.zip")).isEqualTo("test(2).zip");
        assertThat(FileUtils.getUniqueFileName(dir.toString(), "other.zip")).isEqualTo("other.zip");
    }

    @Test
    void uniqueNameAlsoSkipsReservedNames() {
        assertThat(FileUtils.getUniqueFileName(dir.toString(), "a.bin", name -> name.equals("a.bin")))
                .isEqualTo("a(1).bin");
    }
}
