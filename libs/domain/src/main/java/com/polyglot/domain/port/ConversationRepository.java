package com.polyglot.domain.port;

import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.ConversationStatus;
import com.polyglot.domain.exception.ConflictException;
import com.polyglot.domain.exception.NotFoundException;
import com.polyglot.domain.user.UserId;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Storage of conversations together with their messages. */
public interface ConversationRepository {

    Optional<Conversation> findById(ConversationId id);

    /** @throws NotFoundException when no conversation has this id */
    default Conversation get(ConversationId id) {
        return findById(id).orElseThrow(() -> new NotFoundException("Conversation", id.toString()));
    }

    /**
     * Persists the conversation and its messages atomically.
     *
     * @throws ConflictException when the stored version differs from {@link Conversation#version()}
     */
    void save(Conversation conversation);

    /**
     * Conversations owned by {@code userId} whose status is in {@code statusFilter}. An empty filter
     * means no restriction. Order is unspecified.
     */
    List<Conversation> listByUser(UserId userId, Set<ConversationStatus> statusFilter);
}
