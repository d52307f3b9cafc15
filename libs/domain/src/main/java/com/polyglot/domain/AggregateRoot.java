package com.polyglot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Base class for identity-bearing aggregates.
 *
 * <p>Two aggregates are equal when they have the same concrete type and id, whatever their state.
 * The {@link #version()} is the persisted version this instance was loaded at (0 for a new
 * aggregate). Repository adapters compare it on save to detect concurrent writers. The domain
 * never changes it.
 *
 * @param <ID> identifier type
 */
public abstract class AggregateRoot<ID> {

    private final ID id;
    private final Instant createdAt;
    private final long version;

    protected AggregateRoot(ID id, Instant createdAt, long version) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        this.version = version;
    }

    public ID id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public long version() {
        return version;
    }

    /** True for an aggregate that has never been saved. */
    public boolean isNew() {
        return version == 0;
    }

    @Override
    public final boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return id.equals(((AggregateRoot<?>) other).id);
    }

    @Override
    public final int hashCode() {
        return id.hashCode();
    }
}
