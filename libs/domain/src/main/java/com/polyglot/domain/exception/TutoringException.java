package com.polyglot.domain.exception;

/**
 * Root of every exception raised by the tutoring core.
 *
 * <p>WHY unchecked: invariant violations are programming or input errors that the caller cannot
 * recover from locally. Use cases let them propagate unmodified and the adapter layer maps {@link
 * #kind()} to a transport response.
 */
public abstract class TutoringException extends RuntimeException {

    private final ErrorKind kind;

    protected TutoringException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TutoringException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** The taxonomy entry this exception belongs to. */
    public ErrorKind kind() {
        return kind;
    }
}
