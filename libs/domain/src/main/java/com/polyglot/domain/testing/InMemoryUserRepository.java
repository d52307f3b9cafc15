package com.polyglot.domain.testing;

import com.polyglot.domain.exception.ConflictException;
import com.polyglot.domain.port.UserRepository;
import com.polyglot.domain.user.User;
import com.polyglot.domain.user.UserId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link UserRepository} backed by a map, for tests.
 * <p>
 * Stores and hands out copies, so a caller mutating a loaded user changes nothing until it saves.
 * Saves are versioned like a real adapter: saving a stale copy throws {@link ConflictException}.
 */
public final class InMemoryUserRepository implements UserRepository {

    private final Map<UserId, User> store = new ConcurrentHashMap<>();
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public Optional<User> findById(UserId id) {
        return Optional.ofNullable(store.get(id)).map(u -> copy(u, u.version()));
    }

    @Override
    public synchronized void save(User user) {
        User stored = store.get(user.id());
        long actual = stored == null ? 0 : stored.version();
        if (user.version() != actual) {
            throw new ConflictException("User", user.id().toString(), user.version(), actual);
        }
        store.put(user.id(), copy(user, actual + 1));
        saveCount.incrementAndGet();
    }

    /** Number of successful saves since creation. */
    public int saveCount() {
        return saveCount.get();
    }

    public int size() {
        return store.size();
    }

    static User copy(User user, long version) {
        return User.restore(
                user.id(), user.nativeLanguage(), user.targetLanguage(), user.levels(), user.createdAt(), version);
    }
}
