package com.polyglot.domain.language;

import com.polyglot.domain.exception.ValidationException;

/**
 * A concrete surface form together with its lemma and morphological tags, e.g. "casas" ->
 * lemma "casa" (NOUN, es), plural feminine.
 *
 * <p>Vocabulary is tracked per distinct lexeme: two lexemes are the same word for a learner only if
 * surface form, lemma and morphology all match.
 *
 * @param surfaceForm the word as written
 * @param lemma dictionary entry it inflects
 * @param morphology grammatical features of this form
 */
public record Lexeme(String surfaceForm, Lemma lemma, Morphology morphology) {

    public Lexeme {
        if (surfaceForm == null || surfaceForm.isBlank()) {
            throw new ValidationException("lexeme", "surface form must not be null or blank");
        }
        if (lemma == null) {
            throw new ValidationException("lexeme", "lemma must not be null");
        }
        surfaceForm = surfaceForm.strip();
        if (morphology == null) {
            morphology = Morphology.none();
        }
    }

    /** Lexeme whose surface form is the lemma itself, with no morphology. */
    public static Lexeme ofLemma(Lemma lemma) {
        return new Lexeme(lemma.term(), lemma, Morphology.none());
    }

    public Language language() {
        return lemma.language();
    }

    @Override
    public String toString() {
        return surfaceForm + " (" + lemma.term() + ", " + lemma.language() + ")";
    }
}
