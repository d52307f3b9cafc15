package com.polyglot.domain.port;

import com.polyglot.domain.exception.ConflictException;
import com.polyglot.domain.exception.NotFoundException;
import com.polyglot.domain.user.User;
import com.polyglot.domain.user.UserId;
import java.util.Optional;

/** Storage of learners. */
public interface UserRepository {

    Optional<User> findById(UserId id);

    /** @throws NotFoundException when no learner has this id */
    default User get(UserId id) {
        return findById(id).orElseThrow(() -> new NotFoundException("User", id.toString()));
    }

    /**
     * Persists the learner atomically.
     *
     * @throws ConflictException when the stored version differs from {@link User#version()}
     */
    void save(User user);
}
