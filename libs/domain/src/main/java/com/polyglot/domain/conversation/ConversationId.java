package com.polyglot.domain.conversation;

import java.util.Objects;
import java.util.UUID;

/** Conversation identifier (Value Object). */
public record ConversationId(UUID value) {

    public ConversationId {
        Objects.requireNonNull(value, "ConversationId value cannot be null");
    }

    public static ConversationId generate() {
        return new ConversationId(UUID.randomUUID());
    }

    public static ConversationId of(String value) {
        return new ConversationId(UUID.fromString(value));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
