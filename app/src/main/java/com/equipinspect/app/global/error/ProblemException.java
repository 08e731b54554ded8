package com.equipinspect.app.global.error;

/**
 * Base of every failure surfaced to the application shell. Carries a stable code the shell
 * can map to a message and a human-readable detail.
 */
public class ProblemException extends RuntimeException {

    private final String code;
    private final String detail;

    public ProblemException(String code, String detail) {
        this(code, detail, null);
    }

    public ProblemException(String code, String detail, Throwable cause) {
        super(buildMessage(code, detail), cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    private static String buildMessage(String code, String detail) {
        if (detail == null || detail.isBlank()) {
            return code;
        }
        return code + ": " + detail;
    }
}
