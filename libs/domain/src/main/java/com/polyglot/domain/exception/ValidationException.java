package com.polyglot.domain.exception;

/** Thrown when a value object or entity rejects its input. */
public class ValidationException extends TutoringException {

    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, "Invalid %s: %s".formatted(field, message));
        this.field = field;
    }

    /** Name of the rejected field or value object. */
    public String field() {
        return field;
    }
}
