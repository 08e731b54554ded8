package com.equipinspect.app.modules.photo.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Upload limits and output parameters bound from {@code app.photo}.
 */
@ConfigurationProperties(prefix = "app.photo")
public class PhotoProperties {

    private DataSize maxFileSize = DataSize.ofMegabytes(10);

    /**
     * Bounding box of the optimized copy; the aspect ratio is kept and images are never enlarged.
     */
    private int maxWidth = 1920;
    private int maxHeight = 1080;

    /**
     * Both sides of the square box the thumbnail must fit into.
     */
    private int thumbnailSize = 300;

    private float quality = 0.85f;
    private float thumbnailQuality = 0.80f;

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    public void setMaxWidth(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public int getMaxHeight() {
        return maxHeight;
    }

    public void setMaxHeight(int maxHeight) {
        this.maxHeight = maxHeight;
    }

    public int getThumbnailSize() {
        return thumbnailSize;
    }

    public void setThumbnailSize(int thumbnailSize) {
        this.thumbnailSize = thumbnailSize;
    }

    public float getQuality() {
        return quality;
    }

    public void setQuality(float quality) {
        this.quality = quality;
    }

    public float getThumbnailQuality() {
        return thumbnailQuality;
    }

    public void setThumbnailQuality(float thumbnailQuality) {
        this.thumbnailQuality = thumbnailQuality;
    }
}
