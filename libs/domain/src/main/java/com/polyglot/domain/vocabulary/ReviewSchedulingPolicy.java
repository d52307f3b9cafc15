package com.polyglot.domain.vocabulary;

import com.polyglot.domain.exception.ValidationException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Spaced-repetition interval model.
 *
 * <p>The interval starts at {@link #minimumInterval()} and the first review is due one minimum
 * interval after the first encounter. Then, per recorded outcome:
 *
 * <ul>
 *   <li>CORRECT: interval multiplied by {@link #growthFactor()}, capped at {@link
 *       #maximumInterval()}; next due = review time + interval
 *   <li>INCORRECT: interval reset to the minimum; next due = review time + minimum
 *   <li>SKIPPED: interval unchanged; next due = review time + minimum
 * </ul>
 *
 * <p>WHY a pure fold: the review history is the only stored state. Tier and due date are recomputed
 * on demand so they cannot drift from what was recorded.
 */
public record ReviewSchedulingPolicy(Duration minimumInterval, Duration maximumInterval, double growthFactor) {

    public static final Duration DEFAULT_MINIMUM_INTERVAL = Duration.ofDays(1);
    public static final Duration DEFAULT_MAXIMUM_INTERVAL = Duration.ofDays(64);
    public static final double DEFAULT_GROWTH_FACTOR = 2.0;

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    public ReviewSchedulingPolicy {
        if (minimumInterval == null || minimumInterval.isNegative() || minimumInterval.isZero()) {
            throw new ValidationException("review.minimumInterval", "minimum interval must be positive");
        }
        if (maximumInterval == null || maximumInterval.compareTo(minimumInterval) < 0) {
            throw new ValidationException(
                    "review.maximumInterval",
                    "maximum interval must be at least the minimum interval %s".formatted(minimumInterval));
        }
        if (Double.isNaN(growthFactor) || Double.isInfinite(growthFactor) || growthFactor < 1.0) {
            throw new ValidationException(
                    "review.growthFactor", "growth factor must be >= 1.0, was %s".formatted(growthFactor));
        }
    }

    /** 1 day minimum, 64 days maximum, doubling on every correct answer. */
    public static ReviewSchedulingPolicy defaults() {
        return new ReviewSchedulingPolicy(DEFAULT_MINIMUM_INTERVAL, DEFAULT_MAXIMUM_INTERVAL, DEFAULT_GROWTH_FACTOR);
    }

    /**
     * Derives the schedule for an item first encountered at {@code firstEncounteredAt} with the
     * given review history, oldest first.
     */
    public ReviewSchedule schedule(Instant firstEncounteredAt, List<ReviewEvent> history) {
        Duration interval = minimumInterval;
        Instant nextDueAt = firstEncounteredAt.plus(minimumInterval);
        int correctStreak = 0;

        for (ReviewEvent event : history) {
            switch (event.outcome()) {
                case CORRECT -> {
                    interval = grow(interval);
                    nextDueAt = event.reviewedAt().plus(interval);
                    correctStreak++;
                }
                case INCORRECT -> {
                    interval = minimumInterval;
                    nextDueAt = event.reviewedAt().plus(minimumInterval);
                    correctStreak = 0;
                }
                case SKIPPED -> nextDueAt = event.reviewedAt().plus(minimumInterval);
            }
        }
        return new ReviewSchedule(tierOf(history, interval, correctStreak), interval, nextDueAt, history.size(), correctStreak);
    }

    /** Result lies in [interval, maximumInterval], down to nanosecond precision. */
    private Duration grow(Duration interval) {
        double grownSeconds = seconds(interval) * growthFactor;
        if (grownSeconds >= seconds(maximumInterval)) {
            return maximumInterval;
        }
        long whole = (long) grownSeconds;
        Duration grown = Duration.ofSeconds(whole, Math.round((grownSeconds - whole) * NANOS_PER_SECOND));
        if (grown.compareTo(interval) < 0) {
            return interval;
        }
        return grown.compareTo(maximumInterval) > 0 ? maximumInterval : grown;
    }

    private static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / (double) NANOS_PER_SECOND;
    }

    private MasteryTier tierOf(List<ReviewEvent> history, Duration interval, int correctStreak) {
        if (history.isEmpty()) {
            return MasteryTier.NEW;
        }
        if (correctStreak == 0) {
            return MasteryTier.LEARNING;
        }
        return interval.equals(maximumInterval) ? MasteryTier.MASTERED : MasteryTier.FAMILIAR;
    }
}
