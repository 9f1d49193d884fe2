package com.bidscope.error;

/**
 * Exception thrown when query execution against the columnar store fails.
 * Carries the operation and, where known, the rendered SQL.
 */
public class BackingStoreException extends BidScopeException {

    private final String operation;
    private final String query;

    public BackingStoreException(String message, String operation) {
        super(message);
        this.operation = operation;
        this.query = null;
    }

    public BackingStoreException(String message, String operation, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.query = null;
    }

    public BackingStoreException(String message, String operation, String query, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.query = query;
    }

    public String getOperation() {
        return operation;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.BACKING_STORE;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (operation != null) {
            sb.append(" [Operation: ").append(operation).append("]");
        }
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
