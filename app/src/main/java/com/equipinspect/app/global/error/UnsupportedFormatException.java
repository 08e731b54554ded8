package com.equipinspect.app.global.error;

import java.nio.file.Path;

public class UnsupportedFormatException extends PhotoRejectedException {

    public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";

    public UnsupportedFormatException(Path file, String detail) {
        super(UNSUPPORTED_FORMAT, file, detail);
    }
}
