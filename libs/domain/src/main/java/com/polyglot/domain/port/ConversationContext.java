package com.polyglot.domain.port;

import com.polyglot.domain.conversation.ChatMessage;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.language.CefrLevel;
import com.polyglot.domain.language.Language;
import java.util.List;
import java.util.Objects;

/**
 * Everything the AI tutor needs to answer the next turn.
 *
 * @param history messages in append order, the last one being the learner turn to answer
 */
public record ConversationContext(
        ConversationId conversationId,
        Language nativeLanguage,
        Language targetLanguage,
        CefrLevel learnerLevel,
        List<ChatMessage> history) {

    public ConversationContext {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        Objects.requireNonNull(nativeLanguage, "nativeLanguage must not be null");
        Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
        Objects.requireNonNull(learnerLevel, "learnerLevel must not be null");
        history = history == null ? List.of() : List.copyOf(history);
    }

    /** Snapshot of a conversation for a learner at {@code learnerLevel}. */
    public static ConversationContext of(Conversation conversation, CefrLevel learnerLevel) {
        return new ConversationContext(
                conversation.id(),
                conversation.nativeLanguage(),
                conversation.targetLanguage(),
                learnerLevel,
                conversation.messages());
    }
}
