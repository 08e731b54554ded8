package com.equipinspect.app.global.error;

/**
 * Database or filesystem failure. The original cause is always kept.
 */
public class StorageException extends ProblemException {

    public static final String DATABASE_FAILURE = "DATABASE_FAILURE";
    public static final String FILE_NOT_READABLE = "FILE_NOT_READABLE";
    public static final String FILE_WRITE_FAILED = "FILE_WRITE_FAILED";

    public StorageException(String code, String detail, Throwable cause) {
        super(code, detail, cause);
    }

    public StorageException(String code, String detail) {
        super(code, detail);
    }
}
