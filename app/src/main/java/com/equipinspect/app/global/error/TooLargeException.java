package com.equipinspect.app.global.error;

import java.nio.file.Path;

public class TooLargeException extends PhotoRejectedException {

    public static final String TOO_LARGE = "TOO_LARGE";

    private final long sizeBytes;
    private final long limitBytes;

    public TooLargeException(Path file, long sizeBytes, long limitBytes) {
        super(TOO_LARGE, file, "File is %.1f MB, the limit is %.1f MB"
                .formatted(sizeBytes / (1024.0 * 1024.0), limitBytes / (1024.0 * 1024.0)));
        this.sizeBytes = sizeBytes;
        this.limitBytes = limitBytes;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
