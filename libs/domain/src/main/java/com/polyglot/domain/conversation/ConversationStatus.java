package com.polyglot.domain.conversation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link Conversation}.
 *
 * <p>WHY the transitions live on the enum: the state machine is encoded once here instead of being
 * re-derived by every operation.
 *
 * <ul>
 *   <li>ACTIVE can move to ARCHIVED or DELETED
 *   <li>ARCHIVED can move to ACTIVE or DELETED
 *   <li>DELETED is terminal
 * </ul>
 */
public enum ConversationStatus {
    ACTIVE,
    ARCHIVED,
    DELETED;

    /** Statuses directly reachable from this one. A status never transitions to itself. */
    public Set<ConversationStatus> allowedTransitions() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(ARCHIVED, DELETED);
            case ARCHIVED -> EnumSet.of(ACTIVE, DELETED);
            case DELETED -> EnumSet.noneOf(ConversationStatus.class);
        };
    }

    public boolean canTransitionTo(ConversationStatus target) {
        return allowedTransitions().contains(target);
    }

    /** Only ACTIVE conversations accept new messages or title changes. */
    public boolean acceptsMessages() {
        return this == ACTIVE;
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }
}
