package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.ChatMessage;
import com.polyglot.domain.conversation.MessageId;
import com.polyglot.domain.conversation.Role;

import java.time.Instant;

public record MessageView(MessageId id, Role role, String content, Instant createdAt) {

    static MessageView of(ChatMessage message) {
        return new MessageView(message.id(), message.role(), message.content(), message.createdAt());
    }
}
