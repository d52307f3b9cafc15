package com.polyglot.domain.exception;

/**
 * Thrown by a repository port when a save loses an optimistic-concurrency race.
 *
 * <p>Mutating use cases retry once on this exception before surfacing it.
 */
public class ConflictException extends TutoringException {

    private final String resourceType;
    private final String resourceId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConflictException(
            String resourceType, String resourceId, long expectedVersion, long actualVersion) {
        super(
                ErrorKind.CONFLICT,
                "Concurrent modification of %s '%s': expected version %d but found %d"
                        .formatted(resourceType, resourceId, expectedVersion, actualVersion));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceId() {
        return resourceId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
