package com.equipinspect.app.global.error;

/**
 * Rejected input: a bad date, a value outside the option catalog, a missing field.
 */
public class ValidationException extends ProblemException {

    public static final String INVALID_DATE = "INVALID_DATE";
    public static final String INVALID_RANGE = "INVALID_RANGE";
    public static final String UNKNOWN_OPTION = "UNKNOWN_OPTION";
    public static final String SEQUENCE_OUT_OF_RANGE = "SEQUENCE_OUT_OF_RANGE";
    public static final String INVALID_FIELD = "INVALID_FIELD";

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String code, String field, Object rejectedValue, String detail) {
        super(code, detail);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
