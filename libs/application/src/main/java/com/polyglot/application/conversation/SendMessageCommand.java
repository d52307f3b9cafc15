package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.Role;

/** Appends a message; a USER message is answered by the AI tutor. */
public record SendMessageCommand(ConversationId conversationId, Role role, String content) {
}
