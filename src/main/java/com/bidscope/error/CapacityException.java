package com.bidscope.error;

/**
 * The interactive path cannot serve this request within its limits.
 * Callers should resubmit the same request as a task.
 */
public class CapacityException extends BidScopeException {

    private final String operation;

    public CapacityException(String message, String operation) {
        super(message);
        this.operation = operation;
    }

    public CapacityException(String message, String operation, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CAPACITY;
    }
}
