package com.polyglot.domain.vocabulary;

/** Result of one review of a vocabulary item. */
public enum ReviewOutcome {
    CORRECT,
    INCORRECT,
    SKIPPED
}
