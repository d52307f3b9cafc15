package com.polyglot.application.user;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.port.UserRepository;
import com.polyglot.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Switches a learner's target language. Existing conversations keep their language pair. */
public final class SwitchTargetLanguageHandler implements CommandHandler<SwitchTargetLanguageCommand, Void> {

    private static final Logger log = LoggerFactory.getLogger(SwitchTargetLanguageHandler.class);

    private final UserRepository users;

    public SwitchTargetLanguageHandler(UserRepository users) {
        this.users = users;
    }

    @Override
    public Void handle(SwitchTargetLanguageCommand command) {
        UseCaseLogContext.run("SwitchTargetLanguage", command.userId(), null,
                () -> ConflictRetry.retryOnce("SwitchTargetLanguage", () -> {
                    User user = users.get(command.userId());
                    user.switchTargetLanguage(command.newTarget(), command.startingLevel());
                    users.save(user);
                    log.info("User {} now learning {} at {}", user.id(), user.targetLanguage(), user.currentLevel());
                }));
        return null;
    }
}
