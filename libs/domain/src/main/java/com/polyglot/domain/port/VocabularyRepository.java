package com.polyglot.domain.port;

import com.polyglot.domain.exception.ConflictException;
import com.polyglot.domain.exception.NotFoundException;
import com.polyglot.domain.language.Lexeme;
import com.polyglot.domain.user.UserId;
import com.polyglot.domain.vocabulary.ReviewSchedulingPolicy;
import com.polyglot.domain.vocabulary.VocabularyItem;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Storage of vocabulary items, unique per (user, lexeme). */
public interface VocabularyRepository {

    Optional<VocabularyItem> find(UserId userId, Lexeme lexeme);

    /** @throws NotFoundException when the learner never encountered this lexeme */
    default VocabularyItem get(UserId userId, Lexeme lexeme) {
        return find(userId, lexeme)
                .orElseThrow(() -> new NotFoundException("VocabularyItem", userId + "/" + lexeme));
    }

    /**
     * Persists the item and its history atomically.
     *
     * @throws ConflictException when the stored version differs, or when another item already exists
     *     for the same user and lexeme
     */
    void save(VocabularyItem item);

    List<VocabularyItem> listByUser(UserId userId);

    /**
     * Items due for review at {@code asOf}, soonest due first.
     *
     * <p>Adapters may override this with an index but must return the same items as this default.
     */
    default List<VocabularyItem> listDue(UserId userId, Instant asOf, ReviewSchedulingPolicy policy) {
        return listByUser(userId).stream()
                .filter(item -> item.isDue(policy, asOf))
                .sorted((a, b) -> a.schedule(policy).nextDueAt().compareTo(b.schedule(policy).nextDueAt()))
                .toList();
    }
}
