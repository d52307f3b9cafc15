package com.polyglot.domain.vocabulary;

import java.time.Duration;
import java.time.Instant;

/**
 * State derived from a review history by {@link ReviewSchedulingPolicy#schedule}. Never stored.
 *
 * @param tier mastery tier
 * @param interval current review interval
 * @param nextDueAt first instant at which the item is due
 * @param reviewCount number of recorded reviews
 * @param correctStreak consecutive CORRECT outcomes since the last INCORRECT, SKIPPED ignored
 */
public record ReviewSchedule(
        MasteryTier tier, Duration interval, Instant nextDueAt, int reviewCount, int correctStreak) {

    public boolean isDueAt(Instant asOf) {
        return !asOf.isBefore(nextDueAt);
    }
}
