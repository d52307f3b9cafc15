package com.polyglot.domain.language;

import com.polyglot.domain.exception.ValidationException;

/**
 * Canonical dictionary form of a word, scoped to a language ("run" for "runs", "ran").
 *
 * @param term dictionary form, trimmed and non-blank
 * @param partOfSpeech word class
 * @param language language the term belongs to
 */
public record Lemma(String term, PartOfSpeech partOfSpeech, Language language) {

    public Lemma {
        if (term == null || term.isBlank()) {
            throw new ValidationException("lemma", "term must not be null or blank");
        }
        if (language == null) {
            throw new ValidationException("lemma", "language must not be null");
        }
        term = term.strip();
        if (partOfSpeech == null) {
            partOfSpeech = PartOfSpeech.UNKNOWN;
        }
    }

    public static Lemma of(String term, PartOfSpeech partOfSpeech, Language language) {
        return new Lemma(term, partOfSpeech, language);
    }
}
