package com.polyglot.application.conversation;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.conversation.MessageId;
import com.polyglot.domain.conversation.Role;
import com.polyglot.domain.exception.ProviderException;
import com.polyglot.domain.language.CefrLevel;
import com.polyglot.domain.port.AiTutor;
import com.polyglot.domain.port.ConversationContext;
import com.polyglot.domain.port.ConversationRepository;
import com.polyglot.domain.port.UserRepository;
import com.polyglot.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Appends a message to a conversation.
 *
 * <p>For a USER message the AI tutor is asked for a reply, and both messages are saved together.
 * If the tutor fails, nothing is saved and the failure propagates: the learner's message is not
 * kept without an answer. On a save conflict the whole cycle, tutor call included, runs once more
 * against the reloaded conversation with the same message ids.
 */
public final class SendMessageHandler implements CommandHandler<SendMessageCommand, SendMessageResult> {

    private static final Logger log = LoggerFactory.getLogger(SendMessageHandler.class);

    private final ConversationRepository conversations;
    private final UserRepository users;
    private final AiTutor tutor;
    private final Clock clock;

    public SendMessageHandler(
            ConversationRepository conversations, UserRepository users, AiTutor tutor, Clock clock) {
        this.conversations = conversations;
        this.users = users;
        this.tutor = tutor;
        this.clock = clock;
    }

    @Override
    public SendMessageResult handle(SendMessageCommand command) {
        MessageId messageId = MessageId.generate();
        MessageId replyId = command.role().expectsReply() ? MessageId.generate() : null;
        return UseCaseLogContext.call("SendMessage", null, command.conversationId(),
                () -> ConflictRetry.retryOnce("SendMessage", () -> send(command, messageId, replyId)));
    }

    private SendMessageResult send(SendMessageCommand command, MessageId messageId, MessageId replyId) {
        Conversation conversation = conversations.get(command.conversationId());
        conversation.requireActive();

        Instant sentAt = clock.instant();
        conversation.appendMessage(messageId, command.role(), command.content(), sentAt);

        if (replyId != null) {
            String reply = askTutor(conversation);
            Instant repliedAt = clock.instant();
            conversation.appendMessage(replyId, Role.ASSISTANT, reply, repliedAt.isBefore(sentAt) ? sentAt : repliedAt);
        }

        conversations.save(conversation);
        log.info("Appended {} message {} to conversation {}{}",
                command.role(), messageId, conversation.id(), replyId != null ? " with reply " + replyId : "");
        return new SendMessageResult(messageId, replyId);
    }

    private String askTutor(Conversation conversation) {
        User learner = users.get(conversation.ownerId());
        CefrLevel level = learner.levelFor(conversation.targetLanguage()).orElse(learner.currentLevel());
        ConversationContext context = ConversationContext.of(conversation, level);

        long started = System.nanoTime();
        String reply = tutor.generateReply(context, conversation.tutorProfile());
        log.debug("Tutor replied in {} ms for conversation {} ({} messages of history)",
                (System.nanoTime() - started) / 1_000_000, conversation.id(), context.history().size());

        if (reply == null || reply.isBlank()) {
            throw new ProviderException("generateReply", "tutor returned an empty reply");
        }
        return reply;
    }
}
