package com.polyglot.application.conversation;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.port.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public final class RenameConversationHandler implements CommandHandler<RenameConversationCommand, Void> {

    private static final Logger log = LoggerFactory.getLogger(RenameConversationHandler.class);

    private final ConversationRepository conversations;
    private final Clock clock;

    public RenameConversationHandler(ConversationRepository conversations, Clock clock) {
        this.conversations = conversations;
        this.clock = clock;
    }

    @Override
    public Void handle(RenameConversationCommand command) {
        UseCaseLogContext.run("RenameConversation", null, command.conversationId(),
                () -> ConflictRetry.retryOnce("RenameConversation", () -> {
                    Conversation conversation = conversations.get(command.conversationId());
                    conversation.rename(command.title(), clock.instant());
                    conversations.save(conversation);
                    log.info("Renamed conversation {}", conversation.id());
                }));
        return null;
    }
}
