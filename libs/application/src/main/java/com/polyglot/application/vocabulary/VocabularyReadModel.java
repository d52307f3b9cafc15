package com.polyglot.application.vocabulary;

import com.polyglot.domain.language.Language;
import com.polyglot.domain.language.PartOfSpeech;
import com.polyglot.domain.vocabulary.MasteryTier;
import com.polyglot.domain.vocabulary.ReviewSchedule;
import com.polyglot.domain.vocabulary.VocabularyItem;
import com.polyglot.domain.vocabulary.VocabularyItemId;
import com.polyglot.domain.vocabulary.VocabularySource;

import java.time.Instant;

/**
 * A vocabulary item as shown in a review session.
 *
 * @param lastReviewedAt null when never reviewed
 */
public record VocabularyReadModel(
        VocabularyItemId id,
        String surfaceForm,
        String lemma,
        PartOfSpeech partOfSpeech,
        Language language,
        VocabularySource source,
        MasteryTier tier,
        Instant nextDueAt,
        int reviewCount,
        Instant firstEncounteredAt,
        Instant lastReviewedAt) {

    static VocabularyReadModel of(VocabularyItem item, ReviewSchedule schedule) {
        return new VocabularyReadModel(
                item.id(),
                item.lexeme().surfaceForm(),
                item.lexeme().lemma().term(),
                item.lexeme().lemma().partOfSpeech(),
                item.language(),
                item.source(),
                schedule.tier(),
                schedule.nextDueAt(),
                schedule.reviewCount(),
                item.firstEncounteredAt(),
                item.lastReviewedAt().orElse(null));
    }
}
