package com.equipinspect.app.modules.photo.domain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Image formats accepted on upload, keyed by file extension.
 */
public enum PhotoFormat {
    JPEG("jpg", "jpeg"),
    PNG("png"),
    GIF("gif"),
    BMP("bmp"),
    TIFF("tif", "tiff");

    private final List<String> extensions;

    PhotoFormat(String... extensions) {
        this.extensions = List.of(extensions);
    }

    public static Optional<PhotoFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        for (PhotoFormat format : values()) {
            if (format.extensions.contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Lower-cased extension of a file name, or an empty string when it has none.
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
