package com.equipinspect.app.global.error;

public class NotFoundException extends ProblemException {

    public static final String RECORD_NOT_FOUND = "RECORD_NOT_FOUND";

    private final Long recordId;

    public NotFoundException(Long recordId) {
        super(RECORD_NOT_FOUND, "Inspection record " + recordId + " does not exist or was deleted");
        this.recordId = recordId;
    }

    public Long getRecordId() {
        return recordId;
    }
}
