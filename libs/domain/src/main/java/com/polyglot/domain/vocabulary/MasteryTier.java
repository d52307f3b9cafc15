package com.polyglot.domain.vocabulary;

/** Coarse mastery level derived from review history. */
public enum MasteryTier {
    /** Never reviewed. */
    NEW,
    /** Reviewed, but the last graded review was wrong or nothing was answered correctly yet. */
    LEARNING,
    /** On a correct streak, interval still growing. */
    FAMILIAR,
    /** On a correct streak at the maximum interval. */
    MASTERED
}
