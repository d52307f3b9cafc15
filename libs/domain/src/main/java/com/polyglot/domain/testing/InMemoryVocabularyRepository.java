package com.polyglot.domain.testing;

import com.polyglot.domain.exception.ConflictException;
import com.polyglot.domain.language.Lexeme;
import com.polyglot.domain.port.VocabularyRepository;
import com.polyglot.domain.user.UserId;
import com.polyglot.domain.vocabulary.VocabularyItem;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link VocabularyRepository} backed by a map keyed by (user, lexeme), for tests.
 * <p>
 * Same copy and versioning rules as {@link InMemoryConversationRepository}. A second item for an
 * already stored (user, lexeme) pair is rejected as a conflict, the way a unique index would.
 */
public final class InMemoryVocabularyRepository implements VocabularyRepository {

    private record Key(UserId userId, Lexeme lexeme) {
    }

    private final Map<Key, VocabularyItem> store = new ConcurrentHashMap<>();
    private final AtomicInteger saveCount = new AtomicInteger();
    private final AtomicBoolean conflictOnNextSave = new AtomicBoolean(false);

    @Override
    public Optional<VocabularyItem> find(UserId userId, Lexeme lexeme) {
        return Optional.ofNullable(store.get(new Key(userId, lexeme))).map(i -> copy(i, i.version()));
    }

    @Override
    public synchronized void save(VocabularyItem item) {
        Key key = new Key(item.ownerId(), item.lexeme());
        VocabularyItem stored = store.get(key);
        long actual = stored == null ? 0 : stored.version();
        String resourceId = item.ownerId() + "/" + item.lexeme();
        if (conflictOnNextSave.getAndSet(false) && stored != null) {
            store.put(key, copy(stored, actual + 1));
            throw new ConflictException("VocabularyItem", resourceId, item.version(), actual + 1);
        }
        if (stored != null && !stored.id().equals(item.id())) {
            throw new ConflictException("VocabularyItem", resourceId, item.version(), actual);
        }
        if (item.version() != actual) {
            throw new ConflictException("VocabularyItem", resourceId, item.version(), actual);
        }
        store.put(key, copy(item, actual + 1));
        saveCount.incrementAndGet();
    }

    @Override
    public List<VocabularyItem> listByUser(UserId userId) {
        return store.values().stream()
                .filter(i -> i.ownerId().equals(userId))
                .map(i -> copy(i, i.version()))
                .toList();
    }

    /** Makes the next save of an already stored item lose a race against another writer. */
    public InMemoryVocabularyRepository conflictOnNextSave() {
        conflictOnNextSave.set(true);
        return this;
    }

    /** Number of successful saves since creation. */
    public int saveCount() {
        return saveCount.get();
    }

    static VocabularyItem copy(VocabularyItem item, long version) {
        return VocabularyItem.restore(
                item.id(),
                item.ownerId(),
                item.lexeme(),
                item.source(),
                List.copyOf(item.encounters()),
                List.copyOf(item.reviews()),
                version);
    }
}
