package com.polyglot.domain.exception;

/**
 * Thrown when a review cannot be recorded: the learner never encountered the lexeme, or the review
 * would break the chronological order of the history.
 */
public class InvalidReviewOutcomeException extends TutoringException {

    private final String subject;

    public InvalidReviewOutcomeException(String subject, String reason) {
        super(
                ErrorKind.INVALID_REVIEW_OUTCOME,
                "Cannot record review for '%s': %s".formatted(subject, reason));
        this.subject = subject;
    }

    /** The lexeme or vocabulary item the review targeted. */
    public String subject() {
        return subject;
    }
}
