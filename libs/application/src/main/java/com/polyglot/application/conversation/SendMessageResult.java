package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.MessageId;

import java.util.Optional;

/**
 * Ids of the appended messages.
 *
 * @param messageId the message that was sent
 * @param replyId the tutor's answer, null when the sent message did not call for one
 */
public record SendMessageResult(MessageId messageId, MessageId replyId) {

    public Optional<MessageId> reply() {
        return Optional.ofNullable(replyId);
    }
}
