package com.bidscope.error;

/**
 * Signals clean termination after a cancel request. Not a failure.
 */
public class CancelledException extends BidScopeException {

    public CancelledException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CANCELLED;
    }
}
