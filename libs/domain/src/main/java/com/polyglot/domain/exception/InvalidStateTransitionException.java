package com.polyglot.domain.exception;

/** Thrown when a conversation is asked to move to a status its current status cannot reach. */
public class InvalidStateTransitionException extends TutoringException {

    private final String conversationId;
    private final String from;
    private final String to;

    public InvalidStateTransitionException(String conversationId, String from, String to) {
        super(
                ErrorKind.INVALID_STATE_TRANSITION,
                "Conversation '%s' cannot move from %s to %s".formatted(conversationId, from, to));
        this.conversationId = conversationId;
        this.from = from;
        this.to = to;
    }

    public String conversationId() {
        return conversationId;
    }

    public String from() {
        return from;
    }

    public String to() {
        return to;
    }
}
