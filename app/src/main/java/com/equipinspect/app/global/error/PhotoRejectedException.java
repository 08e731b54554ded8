package com.equipinspect.app.global.error;

import java.nio.file.Path;

/**
 * A photo refused before any processing or storage took place.
 */
public abstract class PhotoRejectedException extends ProblemException {

    private final Path file;

    protected PhotoRejectedException(String code, Path file, String detail) {
        super(code, detail);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
