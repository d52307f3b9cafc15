package com.polyglot.application.user;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.port.UserRepository;
import com.polyglot.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Moves a learner one CEFR level up or down. */
public final class ReassessProficiencyHandler implements CommandHandler<ReassessProficiencyCommand, Void> {

    private static final Logger log = LoggerFactory.getLogger(ReassessProficiencyHandler.class);

    private final UserRepository users;

    public ReassessProficiencyHandler(UserRepository users) {
        this.users = users;
    }

    @Override
    public Void handle(ReassessProficiencyCommand command) {
        UseCaseLogContext.run("ReassessProficiency", command.userId(), null,
                () -> ConflictRetry.retryOnce("ReassessProficiency", () -> {
                    User user = users.get(command.userId());
                    user.reassessProficiency(command.newLevel());
                    users.save(user);
                    log.info("User {} reassessed at {} in {}", user.id(), user.currentLevel(), user.targetLanguage());
                }));
        return null;
    }
}
