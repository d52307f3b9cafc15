package com.polyglot.domain.vocabulary;

import com.polyglot.domain.exception.InvalidReviewOutcomeException;
import java.time.Instant;

/** One recorded review. */
public record ReviewEvent(ReviewOutcome outcome, Instant reviewedAt) {

    public ReviewEvent {
        if (outcome == null) {
            throw new InvalidReviewOutcomeException("review", "outcome must not be null");
        }
        if (reviewedAt == null) {
            throw new InvalidReviewOutcomeException("review", "review timestamp must not be null");
        }
    }
}
