package com.polyglot.application.conversation;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.port.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/** ACTIVE to ARCHIVED. Messages are kept. */
public final class ArchiveConversationHandler implements CommandHandler<ArchiveConversationCommand, Void> {

    private static final Logger log = LoggerFactory.getLogger(ArchiveConversationHandler.class);

    private final ConversationRepository conversations;
    private final Clock clock;

    public ArchiveConversationHandler(ConversationRepository conversations, Clock clock) {
        this.conversations = conversations;
        this.clock = clock;
    }

    @Override
    public Void handle(ArchiveConversationCommand command) {
        UseCaseLogContext.run("ArchiveConversation", null, command.conversationId(),
                () -> ConflictRetry.retryOnce("ArchiveConversation", () -> {
                    Conversation conversation = conversations.get(command.conversationId());
                    conversation.archive(clock.instant());
                    conversations.save(conversation);
                    log.info("Archived conversation {}", conversation.id());
                }));
        return null;
    }
}
