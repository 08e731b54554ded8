package com.equipinspect.app.modules.inspection.domain;

/**
 * Paths of the files the photo handler wrote for one record.
 */
public record PhotoReference(String originalPath, String optimizedPath, String thumbnailPath) {
}
