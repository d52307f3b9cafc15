package com.polyglot.application.conversation;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.TutorProfile;
import com.polyglot.domain.port.ConversationRepository;
import com.polyglot.domain.port.UserRepository;
import com.polyglot.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/** Opens an ACTIVE conversation with the learner's current language pair. */
public final class StartConversationHandler implements CommandHandler<StartConversationCommand, ConversationId> {

    private static final Logger log = LoggerFactory.getLogger(StartConversationHandler.class);

    private final UserRepository users;
    private final ConversationRepository conversations;
    private final Clock clock;

    public StartConversationHandler(UserRepository users, ConversationRepository conversations, Clock clock) {
        this.users = users;
        this.conversations = conversations;
        this.clock = clock;
    }

    @Override
    public ConversationId handle(StartConversationCommand command) {
        ConversationId id = ConversationId.generate();
        return UseCaseLogContext.call("StartConversation", command.userId(), id, () -> {
            User user = users.get(command.userId());
            TutorProfile profile = command.tutorProfile() != null ? command.tutorProfile() : TutorProfile.defaults();
            Conversation conversation = Conversation.start(
                    id,
                    user.id(),
                    command.title(),
                    user.nativeLanguage(),
                    user.targetLanguage(),
                    profile,
                    clock.instant());
            conversations.save(conversation);
            log.info("Started conversation {} for user {} in {} ({})",
                    id, user.id(), conversation.targetLanguage(), profile.style());
            return id;
        });
    }
}
