package com.bidscope.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * JSON error body: a machine-readable kind, a readable message and, for validation errors,
 * the offending field.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final Instant timestamp = Instant.now();
    private final String error;
    private final String message;
    private final String field;

    public ErrorResponse(String error, String message) {
        this(error, message, null);
    }

    public ErrorResponse(String error, String message, String field) {
        this.error = error;
        this.message = message;
        this.field = field;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public String getField() {
        return field;
    }
}
