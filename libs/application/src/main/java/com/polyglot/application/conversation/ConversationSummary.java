package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.ConversationStatus;
import com.polyglot.domain.language.Language;

import java.time.Instant;

/** List entry for a conversation. */
public record ConversationSummary(
        ConversationId id,
        String title,
        ConversationStatus status,
        Language targetLanguage,
        int messageCount,
        Instant createdAt,
        Instant lastActivityAt) {

    static ConversationSummary of(Conversation conversation) {
        return new ConversationSummary(
                conversation.id(),
                conversation.title(),
                conversation.status(),
                conversation.targetLanguage(),
                conversation.messageCount(),
                conversation.createdAt(),
                conversation.lastActivityAt());
    }
}
