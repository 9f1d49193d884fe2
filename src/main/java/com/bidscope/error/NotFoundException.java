package com.bidscope.error;

/**
 * A task or export artifact that is unknown or already evicted.
 */
public class NotFoundException extends BidScopeException {

    private final String resource;
    private final String id;

    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
