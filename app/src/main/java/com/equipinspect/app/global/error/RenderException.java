package com.equipinspect.app.global.error;

/**
 * Report generation could not use a required asset, or the PDF itself could not be produced.
 */
public class RenderException extends ProblemException {

    public static final String PHOTO_UNAVAILABLE = "PHOTO_UNAVAILABLE";
    public static final String PDF_FAILED = "PDF_FAILED";

    private final Long recordId;

    public RenderException(String code, Long recordId, String detail, Throwable cause) {
        super(code, detail, cause);
        this.recordId = recordId;
    }

    public RenderException(String code, Long recordId, String detail) {
        this(code, recordId, detail, null);
    }

    public Long getRecordId() {
        return recordId;
    }
}
