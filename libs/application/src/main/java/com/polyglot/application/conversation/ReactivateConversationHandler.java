package com.polyglot.application.conversation;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.port.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/** ARCHIVED back to ACTIVE. */
public final class ReactivateConversationHandler implements CommandHandler<ReactivateConversationCommand, Void> {

    private static final Logger log = LoggerFactory.getLogger(ReactivateConversationHandler.class);

    private final ConversationRepository conversations;
    private final Clock clock;

    public ReactivateConversationHandler(ConversationRepository conversations, Clock clock) {
        this.conversations = conversations;
        this.clock = clock;
    }

    @Override
    public Void handle(ReactivateConversationCommand command) {
        UseCaseLogContext.run("ReactivateConversation", null, command.conversationId(),
                () -> ConflictRetry.retryOnce("ReactivateConversation", () -> {
                    Conversation conversation = conversations.get(command.conversationId());
                    conversation.reactivate(clock.instant());
                    conversations.save(conversation);
                    log.info("Reactivated conversation {}", conversation.id());
                }));
        return null;
    }
}
