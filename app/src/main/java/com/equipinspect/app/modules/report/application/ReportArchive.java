package com.equipinspect.app.modules.report.application;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

import com.equipinspect.app.global.config.StorageProperties;
import com.equipinspect.app.global.error.StorageException;
import com.equipinspect.app.modules.report.domain.RenderedReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Saves rendered reports in the reports directory. Existing files are never overwritten: a
 * name already taken gets a numeric suffix.
 */
@Component
public class ReportArchive {

    private static final Logger log = LoggerFactory.getLogger(ReportArchive.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_ATTEMPTS = 1000;

    private final StorageProperties storageProperties;
    private final Clock clock;

    public ReportArchive(StorageProperties storageProperties, Clock clock) {
        this.storageProperties = storageProperties;
        this.clock = clock;
    }

    public Path write(RenderedReport report) {
        Objects.requireNonNull(report, "report is required");
        Path directory = storageProperties.reportsPath();
        String baseName = baseName(report);
        try {
            Files.createDirectories(directory);
            for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
                Path target = directory.resolve(attempt == 0 ? baseName + ".pdf" : baseName + "_" + attempt + ".pdf");
                try {
                    Files.write(target, report.content(), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                    log.info("Saved {} report to {}", report.kind(), target);
                    return target;
                } catch (FileAlreadyExistsException ex) {
                    log.debug("Report file {} already exists, trying next name", target);
                }
            }
        } catch (IOException ex) {
            throw new StorageException(StorageException.FILE_WRITE_FAILED,
                    "Could not save report in " + directory, ex);
        }
        throw new StorageException(StorageException.FILE_WRITE_FAILED,
                "No free file name for report " + baseName + " in " + directory);
    }

    String baseName(RenderedReport report) {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        return switch (report.kind()) {
            case SINGLE -> "inspection_" + safeFileToken(report.subject()) + "_" + timestamp;
            case BATCH -> "batch_" + timestamp;
            case SUMMARY -> "summary_" + timestamp;
        };
    }

    /**
     * TAGs contain '/', which cannot appear in a file name.
     */
    static String safeFileToken(String value) {
        if (value == null || value.isBlank()) {
            return "UNKNOWN";
        }
        return value.trim().replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
