package com.polyglot.domain.exception;

/** Thrown when writing to a conversation that is ARCHIVED or DELETED. */
public class ConversationNotActiveException extends TutoringException {

    private final String conversationId;
    private final String status;

    public ConversationNotActiveException(String conversationId, String status) {
        super(
                ErrorKind.CONVERSATION_NOT_ACTIVE,
                "Operation denied. Conversation '%s' is currently %s"
                        .formatted(conversationId, status));
        this.conversationId = conversationId;
        this.status = status;
    }

    public String conversationId() {
        return conversationId;
    }

    public String status() {
        return status;
    }
}
