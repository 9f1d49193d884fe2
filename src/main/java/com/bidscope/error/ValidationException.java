package com.bidscope.error;

/**
 * Raised when a request cannot be turned into a valid filter or operation.
 * Never reaches the backing store.
 */
public class ValidationException extends BidScopeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (field != null) {
            sb.append(" [Field: ").append(field).append("]");
        }
        return sb.toString();
    }
}
