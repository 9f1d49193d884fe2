package com.bidscope.error;

/**
 * Base type for every failure that crosses a component boundary.
 * Each subclass fixes its {@link ErrorKind}.
 */
public abstract class BidScopeException extends RuntimeException {

    protected BidScopeException(String message) {
        super(message);
    }

    protected BidScopeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();

    /**
     * The message as given, without the context suffixes subclasses add to {@link #getMessage()}.
     */
    public String getReason() {
        return super.getMessage();
    }

    /**
     * Whether a task worker may retry the operation that raised this exception.
     */
    public boolean isRetryable() {
        return false;
    }
}
