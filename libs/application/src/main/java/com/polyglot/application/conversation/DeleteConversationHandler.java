package com.polyglot.application.conversation;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.exception.NotFoundException;
import com.polyglot.domain.port.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Soft-deletes a conversation.
 *
 * <p>A learner who does not own the conversation gets {@link NotFoundException}, so the existence
 * of other learners' conversations is not revealed.
 */
public final class DeleteConversationHandler implements CommandHandler<DeleteConversationCommand, Void> {

    private static final Logger log = LoggerFactory.getLogger(DeleteConversationHandler.class);

    private final ConversationRepository conversations;
    private final Clock clock;

    public DeleteConversationHandler(ConversationRepository conversations, Clock clock) {
        this.conversations = conversations;
        this.clock = clock;
    }

    @Override
    public Void handle(DeleteConversationCommand command) {
        UseCaseLogContext.run("DeleteConversation", command.userId(), command.conversationId(),
                () -> ConflictRetry.retryOnce("DeleteConversation", () -> {
                    Conversation conversation = conversations.get(command.conversationId());
                    if (!conversation.isOwnedBy(command.userId())) {
                        throw new NotFoundException("Conversation", command.conversationId().toString());
                    }
                    conversation.delete(clock.instant());
                    conversations.save(conversation);
                    log.info("Deleted conversation {}", conversation.id());
                }));
        return null;
    }
}
