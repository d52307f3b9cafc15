package com.polyglot.domain.exception;

/** Failure raised inside a port implementation rather than by a domain rule. */
public abstract class PortException extends TutoringException {

    private final String port;

    protected PortException(ErrorKind kind, String port, String message, Throwable cause) {
        super(kind, message, cause);
        this.port = port;
    }

    /** Name of the port that failed (e.g. "AiTutor", "ConversationRepository"). */
    public String port() {
        return port;
    }
}
