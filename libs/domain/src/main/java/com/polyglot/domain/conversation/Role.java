package com.polyglot.domain.conversation;

/** Origin of a chat message. */
public enum Role {
    /** Instructions injected by the platform, never shown as a turn. */
    SYSTEM,
    /** The learner. */
    USER,
    /** The AI tutor. */
    ASSISTANT;

    /** True when the AI tutor is expected to answer a message with this role. */
    public boolean expectsReply() {
        return this == USER;
    }
}
