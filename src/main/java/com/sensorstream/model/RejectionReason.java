package com.sensorstream.model;

/**
 * Why a raw reading was refused by the validator.
 */
public record RejectionReason(Type type, String field, String detail) {

    public enum Type {
        MISSING_FIELD,
        TYPE_ERROR
    }

    public static RejectionReason missingField(String field) {
        return new RejectionReason(Type.MISSING_FIELD, field, "required field is absent");
    }

    public static RejectionReason typeError(String field, String detail) {
        return new RejectionReason(Type.TYPE_ERROR, field, detail);
    }

    /**
     * Reason string reported to callers, e.g. "MISSING_FIELD: pressure".
     */
    public String message() {
        if (type == Type.MISSING_FIELD) {
            return type + ": " + field;
        }
        return type + ": " + field + " " + detail;
    }
}
