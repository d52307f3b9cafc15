package com.polyglot.application.vocabulary;

import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.MessageId;

/** Extracts the vocabulary of one chat message into the owner's vocabulary list. */
public record CaptureVocabularyCommand(ConversationId conversationId, MessageId messageId) {
}
