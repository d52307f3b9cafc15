package com.polyglot.domain.language;

import com.polyglot.domain.exception.ValidationException;
import java.util.Locale;
import java.util.Optional;

/**
 * Common European Framework of Reference proficiency levels, ordered from A1 to C2.
 *
 * <p>WHY an enum: the scale is closed and totally ordered, so {@link #atLeast(CefrLevel)} can rely
 * on declaration order instead of a lookup table.
 */
public enum CefrLevel {
    A1("Beginner - Can understand basic phrases"),
    A2("Elementary - Can communicate in simple tasks"),
    B1("Intermediate - Can deal with most travel situations"),
    B2("Upper Intermediate - Can interact with fluency"),
    C1("Advanced - Can express fluently and spontaneously"),
    C2("Proficient - Can understand everything");

    private final String description;

    CefrLevel(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /** Numeric rank from 1 (A1) to 6 (C2). */
    public int rank() {
        return ordinal() + 1;
    }

    /** Gating check: true when this level is the same as or above {@code other}. */
    public boolean atLeast(CefrLevel other) {
        return compareTo(other) >= 0;
    }

    public boolean isAdjacentTo(CefrLevel other) {
        return Math.abs(rank() - other.rank()) == 1;
    }

    public boolean isBeginner() {
        return this == A1 || this == A2;
    }

    public boolean isIntermediate() {
        return this == B1 || this == B2;
    }

    public boolean isAdvanced() {
        return this == C1 || this == C2;
    }

    /**
     * Looks up a level by its token, case-insensitively.
     *
     * @return the matching level, or empty for an unknown token
     */
    public static Optional<CefrLevel> fromString(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.strip().toUpperCase(Locale.ROOT);
        for (CefrLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a token such as "b2".
     *
     * @throws ValidationException if the token is not one of A1..C2
     */
    public static CefrLevel parse(String token) {
        return fromString(token)
                .orElseThrow(
                        () ->
                                new ValidationException(
                                        "cefrLevel", "unknown CEFR level '%s'".formatted(token)));
    }
}
