package com.polyglot.application.vocabulary;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.exception.InvalidReviewOutcomeException;
import com.polyglot.domain.port.VocabularyRepository;
import com.polyglot.domain.vocabulary.VocabularyItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Appends a review outcome to a vocabulary item.
 *
 * <p>A lexeme the learner never encountered has no item, and reviewing it fails with {@link
 * InvalidReviewOutcomeException} rather than creating one.
 */
public final class RecordVocabularyReviewHandler implements CommandHandler<RecordVocabularyReviewCommand, Void> {

    private static final Logger log = LoggerFactory.getLogger(RecordVocabularyReviewHandler.class);

    private final VocabularyRepository vocabulary;
    private final Clock clock;

    public RecordVocabularyReviewHandler(VocabularyRepository vocabulary, Clock clock) {
        this.vocabulary = vocabulary;
        this.clock = clock;
    }

    @Override
    public Void handle(RecordVocabularyReviewCommand command) {
        UseCaseLogContext.run("RecordVocabularyReview", command.userId(), null,
                () -> ConflictRetry.retryOnce("RecordVocabularyReview", () -> {
                    VocabularyItem item = vocabulary.find(command.userId(), command.lexeme())
                            .orElseThrow(() -> new InvalidReviewOutcomeException(
                                    command.lexeme().surfaceForm(),
                                    "user %s never encountered this lexeme".formatted(command.userId())));
                    item.recordReview(command.outcome(), clock.instant());
                    vocabulary.save(item);
                    log.info("Recorded {} review for vocabulary item {}", command.outcome(), item.id());
                }));
        return null;
    }
}
