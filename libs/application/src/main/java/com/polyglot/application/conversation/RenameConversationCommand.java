package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.ConversationId;

public record RenameConversationCommand(ConversationId conversationId, String title) {
}
