package com.polyglot.application.user;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.port.UserRepository;
import com.polyglot.domain.user.User;
import com.polyglot.domain.user.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/** Creates a learner and returns the new id. */
public final class RegisterUserHandler implements CommandHandler<RegisterUserCommand, UserId> {

    private static final Logger log = LoggerFactory.getLogger(RegisterUserHandler.class);

    private final UserRepository users;
    private final Clock clock;

    public RegisterUserHandler(UserRepository users, Clock clock) {
        this.users = users;
        this.clock = clock;
    }

    @Override
    public UserId handle(RegisterUserCommand command) {
        UserId id = UserId.generate();
        return UseCaseLogContext.call("RegisterUser", id, null, () -> {
            User user = User.register(
                    id, command.nativeLanguage(), command.targetLanguage(), command.startingLevel(), clock.instant());
            users.save(user);
            log.info("Registered user {} ({} -> {}, {})",
                    id, user.nativeLanguage(), user.targetLanguage(), user.currentLevel());
            return id;
        });
    }
}
