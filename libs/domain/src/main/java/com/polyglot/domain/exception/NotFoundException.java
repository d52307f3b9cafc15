package com.polyglot.domain.exception;

/** Thrown by a repository port when the requested aggregate does not exist. */
public class NotFoundException extends TutoringException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(ErrorKind.NOT_FOUND, "%s not found with ID: %s".formatted(resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceId() {
        return resourceId;
    }
}
