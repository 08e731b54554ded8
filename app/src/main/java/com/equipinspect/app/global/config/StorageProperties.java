package com.equipinspect.app.global.config;

import java.nio.file.Path;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local directories the application writes to, bound from {@code app.storage}.
 * <pre>
 * app:
 *   storage:
 *     uploads-dir: uploads
 *     reports-dir: reports
 * </pre>
 * Relative paths resolve against the working directory.
 */
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    /**
     * Root of the per-record photo directories ({@code record-<id>/}).
     */
    private String uploadsDir = "uploads";

    /**
     * Directory receiving archived PDF reports.
     */
    private String reportsDir = "reports";

    public String getUploadsDir() {
        return uploadsDir;
    }

    public void setUploadsDir(String uploadsDir) {
        this.uploadsDir = uploadsDir;
    }

    public String getReportsDir() {
        return reportsDir;
    }

    public void setReportsDir(String reportsDir) {
        this.reportsDir = reportsDir;
    }

    public Path uploadsPath() {
        return Path.of(uploadsDir);
    }

    public Path reportsPath() {
        return Path.of(reportsDir);
    }
}
