package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.ConversationStatus;
import com.polyglot.domain.conversation.TutorProfile;
import com.polyglot.domain.language.Language;

import java.time.Instant;
import java.util.List;

/** A conversation with its full message history, in order. */
public record ConversationDetail(
        ConversationId id,
        String title,
        ConversationStatus status,
        Language nativeLanguage,
        Language targetLanguage,
        TutorProfile tutorProfile,
        Instant createdAt,
        Instant lastActivityAt,
        List<MessageView> messages) {

    public ConversationDetail {
        messages = List.copyOf(messages);
    }
}
