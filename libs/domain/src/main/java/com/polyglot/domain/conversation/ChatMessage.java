package com.polyglot.domain.conversation;

import com.polyglot.domain.exception.ValidationException;
import java.time.Instant;
import java.util.Objects;

/**
 * One message of a {@link Conversation}.
 *
 * <p>Messages have no lifecycle outside their conversation: they are created by {@link
 * Conversation#appendMessage} and are immutable afterwards. Equality is by id.
 */
public final class ChatMessage {

    private final MessageId id;
    private final Role role;
    private final String content;
    private final Instant createdAt;

    private ChatMessage(MessageId id, Role role, String content, Instant createdAt) {
        if (id == null) {
            throw new ValidationException("message.id", "id must not be null");
        }
        if (role == null) {
            throw new ValidationException("message.role", "role must not be null");
        }
        if (content == null || content.isBlank()) {
            throw new ValidationException(
                    "message.content", "message '%s' must have non-empty content".formatted(id));
        }
        if (createdAt == null) {
            throw new ValidationException("message.createdAt", "timestamp must not be null");
        }
        this.id = id;
        this.role = role;
        this.content = content;
        this.createdAt = createdAt;
    }

    static ChatMessage create(MessageId id, Role role, String content, Instant createdAt) {
        return new ChatMessage(id, role, content, createdAt);
    }

    /** Persistence-layer reconstruction; pass the result to {@link Conversation#restore}. */
    public static ChatMessage restore(MessageId id, Role role, String content, Instant createdAt) {
        return new ChatMessage(id, role, content, createdAt);
    }

    public MessageId id() {
        return id;
    }

    public Role role() {
        return role;
    }

    public String content() {
        return content;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isFromLearner() {
        return role == Role.USER;
    }

    public boolean isFromTutor() {
        return role == Role.ASSISTANT;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ChatMessage that && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "[" + role + "] " + id;
    }
}
