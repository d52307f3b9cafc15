package com.polyglot.domain.user;

import com.polyglot.domain.AggregateRoot;
import com.polyglot.domain.exception.ValidationException;
import com.polyglot.domain.language.CefrLevel;
import com.polyglot.domain.language.Language;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A learner.
 *
 * <p>Invariants:
 *
 * <ul>
 *   <li>native language and target language always differ
 *   <li>there is a CEFR level for the current target language
 *   <li>a level changes only through {@link #reassessProficiency}, one step at a time
 * </ul>
 *
 * <p>Levels of previously studied languages are kept, so switching back restores them.
 */
public final class User extends AggregateRoot<UserId> {

    private Language nativeLanguage;
    private Language targetLanguage;
    private final Map<Language, CefrLevel> levels;

    private User(
            UserId id,
            Language nativeLanguage,
            Language targetLanguage,
            Map<Language, CefrLevel> levels,
            Instant createdAt,
            long version) {
        super(id, createdAt, version);
        requireDistinct(nativeLanguage, targetLanguage);
        if (!levels.containsKey(targetLanguage)) {
            throw new ValidationException(
                    "user.level", "no CEFR level recorded for target language '%s'".formatted(targetLanguage));
        }
        this.nativeLanguage = nativeLanguage;
        this.targetLanguage = targetLanguage;
        this.levels = new LinkedHashMap<>(levels);
    }

    /** Registers a new learner starting at {@code startingLevel} in the target language. */
    public static User register(
            UserId id, Language nativeLanguage, Language targetLanguage, CefrLevel startingLevel, Instant now) {
        if (startingLevel == null) {
            throw new ValidationException("user.level", "starting level must not be null");
        }
        requireDistinct(nativeLanguage, targetLanguage);
        return new User(id, nativeLanguage, targetLanguage, Map.of(targetLanguage, startingLevel), now, 0);
    }

    /** Rebuilds a persisted learner. */
    public static User restore(
            UserId id,
            Language nativeLanguage,
            Language targetLanguage,
            Map<Language, CefrLevel> levels,
            Instant createdAt,
            long version) {
        if (levels == null) {
            throw new ValidationException("user.level", "levels must not be null");
        }
        return new User(id, nativeLanguage, targetLanguage, levels, createdAt, version);
    }

    public Language nativeLanguage() {
        return nativeLanguage;
    }

    public Language targetLanguage() {
        return targetLanguage;
    }

    /** Level in the current target language. */
    public CefrLevel currentLevel() {
        return levels.get(targetLanguage);
    }

    public Optional<CefrLevel> levelFor(Language language) {
        return Optional.ofNullable(levels.get(language));
    }

    /** Every language studied so far with its last assessed level. */
    public Map<Language, CefrLevel> levels() {
        return Collections.unmodifiableMap(levels);
    }

    /**
     * Records the result of a proficiency assessment in the current target language.
     *
     * @throws ValidationException if {@code newLevel} is not adjacent to the current level
     */
    public void reassessProficiency(CefrLevel newLevel) {
        if (newLevel == null) {
            throw new ValidationException("user.level", "level must not be null");
        }
        CefrLevel current = currentLevel();
        if (!current.isAdjacentTo(newLevel)) {
            throw new ValidationException(
                    "user.level",
                    "cannot move from %s to %s: reassessment changes the level by exactly one step"
                            .formatted(current, newLevel));
        }
        levels.put(targetLanguage, newLevel);
    }

    /**
     * Starts studying another language. A language studied before keeps its recorded level and
     * {@code startingLevel} is ignored.
     */
    public void switchTargetLanguage(Language newTarget, CefrLevel startingLevel) {
        requireDistinct(nativeLanguage, newTarget);
        if (startingLevel == null) {
            throw new ValidationException("user.level", "starting level must not be null");
        }
        levels.putIfAbsent(newTarget, startingLevel);
        targetLanguage = newTarget;
    }

    /** Fixes a native language entered wrongly at registration. */
    public void correctNativeLanguage(Language newNative) {
        requireDistinct(newNative, targetLanguage);
        nativeLanguage = newNative;
    }

    private static void requireDistinct(Language nativeLanguage, Language targetLanguage) {
        if (nativeLanguage == null) {
            throw new ValidationException("user.nativeLanguage", "native language must not be null");
        }
        if (targetLanguage == null) {
            throw new ValidationException("user.targetLanguage", "target language must not be null");
        }
        if (nativeLanguage.equals(targetLanguage)) {
            throw new ValidationException(
                    "user.targetLanguage",
                    "target language must differ from native language '%s'".formatted(nativeLanguage));
        }
    }

    @Override
    public String toString() {
        return "User[%s %s->%s %s]".formatted(id(), nativeLanguage, targetLanguage, currentLevel());
    }
}
