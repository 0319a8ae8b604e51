package com.stopengine.error;

public class UnknownResourceException extends StopwordException {
    private final String resourceName;

    public UnknownResourceException(String resourceName) {
        super(ErrorKind.UNKNOWN_RESOURCE, "Unknown stopword resource '" + resourceName + "'.");
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
