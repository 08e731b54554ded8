package com.equipinspect.app.modules.report.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import com.equipinspect.app.global.config.StorageProperties;
import com.equipinspect.app.global.error.StorageException;
import com.equipinspect.app.modules.report.domain.RenderedReport;
import com.equipinspect.app.modules.report.domain.ReportKind;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportArchiveTest {

    @TempDir
    Path tempDir;

    private StorageProperties storageProperties;
    private ReportArchive reportArchive;

    @BeforeEach
    void setUp() {
        storageProperties = new StorageProperties();
        storageProperties.setReportsDir(tempDir.resolve("reports").toString());
        reportArchive = new ReportArchive(storageProperties,
                Clock.fixed(Instant.parse("2024-07-01T09:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("single-record report is named after its TAG and the generation time")
    void write_single() throws IOException {
        RenderedReport report = report(ReportKind.SINGLE, "P-1/M01/S01/VP-007");

        Path saved = reportArchive.write(report);

        assertThat(saved.getFileName().toString()).isEqualTo("inspection_P-1_M01_S01_VP-007_20240701_090000.pdf");
        assertThat(saved.getParent()).isEqualTo(tempDir.resolve("reports"));
        assertThat(Files.readAllBytes(saved)).isEqualTo(report.content());
    }

    @Test
    @DisplayName("batch and summary reports use their own prefixes")
    void write_batchAndSummary() {
        assertThat(reportArchive.write(report(ReportKind.BATCH, null)).getFileName().toString())
                .isEqualTo("batch_20240701_090000.pdf");
        assertThat(reportArchive.write(report(ReportKind.SUMMARY, null)).getFileName().toString())
                .isEqualTo("summary_20240701_090000.pdf");
    }

    @Test
    @DisplayName("an existing report is never overwritten")
    void write_collision() throws IOException {
        Path first = reportArchive.write(report(ReportKind.SUMMARY, null));
        Path second = reportArchive.write(report(ReportKind.SUMMARY, null));

        assertThat(second).isNotEqualTo(first);
        assertThat(second.getFileName().toString()).isEqualTo("summary_20240701_090000_1.pdf");
        assertThat(Files.exists(first)).isTrue();
    }

    @Test
    @DisplayName("an unusable reports directory is a storage error")
    void write_directoryIsAFile() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocked"), "file");
        storageProperties.setReportsDir(blocker.toString());

        assertThatThrownBy(() -> reportArchive.write(report(ReportKind.BATCH, null)))
                .isInstanceOf(StorageException.class)
                .extracting(ex -> ((StorageException) ex).getCode())
                .isEqualTo(StorageException.FILE_WRITE_FAILED);
    }

    private static RenderedReport report(ReportKind kind, String subject) {
        return new RenderedReport(kind, "%PDF-1.4 test".getBytes(StandardCharsets.US_ASCII), 1, List.of(), subject);
    }
}
