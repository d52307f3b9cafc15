package com.polyglot.domain.conversation;

import java.util.Objects;
import java.util.UUID;

/** Chat message identifier, unique within its conversation. */
public record MessageId(UUID value) {

    public MessageId {
        Objects.requireNonNull(value, "MessageId value cannot be null");
    }

    public static MessageId generate() {
        return new MessageId(UUID.randomUUID());
    }

    public static MessageId of(String value) {
        return new MessageId(UUID.fromString(value));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
