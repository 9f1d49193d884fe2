package com.bidscope.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable failure categories surfaced to callers.
 */
public enum ErrorKind {
    /** Bad filter or request parameter; reported with the offending field. */
    VALIDATION("validation_error"),
    /** Query execution against the columnar store failed. */
    BACKING_STORE("backing_store_error"),
    /** Result too large or too slow for an interactive call; resubmit as a task. */
    CAPACITY("capacity_error"),
    /** Operation was cancelled by the client. Not a failure. */
    CANCELLED("cancelled"),
    /** Referenced task or export does not exist, or has expired. */
    NOT_FOUND("not_found");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ErrorKind fromValue(String value) {
        for (ErrorKind kind : ErrorKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown error kind: " + value);
    }
}
