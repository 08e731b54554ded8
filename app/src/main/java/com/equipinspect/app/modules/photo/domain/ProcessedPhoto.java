package com.equipinspect.app.modules.photo.domain;

import java.nio.file.Path;

import com.equipinspect.app.modules.inspection.domain.PhotoReference;

/**
 * Files of one photo set written for a record; all three share {@link #directory()}.
 */
public record ProcessedPhoto(Path original, Path optimized, Path thumbnail) {

    public Path directory() {
        return original.getParent();
    }

    public PhotoReference toReference() {
        return new PhotoReference(original.toString(), optimized.toString(), thumbnail.toString());
    }
}
