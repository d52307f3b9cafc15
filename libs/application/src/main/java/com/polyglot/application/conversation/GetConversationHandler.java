package com.polyglot.application.conversation;

import com.polyglot.application.QueryHandler;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.exception.NotFoundException;
import com.polyglot.domain.port.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads one conversation for its owner. Other learners get {@link NotFoundException}. */
public final class GetConversationHandler implements QueryHandler<GetConversationQuery, ConversationDetail> {

    private static final Logger log = LoggerFactory.getLogger(GetConversationHandler.class);

    private final ConversationRepository conversations;

    public GetConversationHandler(ConversationRepository conversations) {
        this.conversations = conversations;
    }

    @Override
    public ConversationDetail handle(GetConversationQuery query) {
        return UseCaseLogContext.call("GetConversation", query.userId(), query.conversationId(), () -> {
            Conversation conversation = conversations.findById(query.conversationId())
                    .filter(c -> c.isOwnedBy(query.userId()))
                    .orElseThrow(() -> new NotFoundException("Conversation", query.conversationId().toString()));
            log.debug("Loaded conversation {} with {} messages", conversation.id(), conversation.messageCount());
            return new ConversationDetail(
                    conversation.id(),
                    conversation.title(),
                    conversation.status(),
                    conversation.nativeLanguage(),
                    conversation.targetLanguage(),
                    conversation.tutorProfile(),
                    conversation.createdAt(),
                    conversation.lastActivityAt(),
                    conversation.messages().stream().map(MessageView::of).toList());
        });
    }
}
