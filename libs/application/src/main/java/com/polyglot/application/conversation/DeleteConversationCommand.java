package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.user.UserId;

/** @param userId the learner asking; must own the conversation */
public record DeleteConversationCommand(ConversationId conversationId, UserId userId) {
}
