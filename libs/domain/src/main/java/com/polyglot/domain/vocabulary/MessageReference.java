package com.polyglot.domain.vocabulary;

import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.MessageId;
import java.util.Objects;

/** Points at the chat message a lexeme was found in. */
public record MessageReference(ConversationId conversationId, MessageId messageId) {

    public MessageReference {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        Objects.requireNonNull(messageId, "messageId must not be null");
    }
}
