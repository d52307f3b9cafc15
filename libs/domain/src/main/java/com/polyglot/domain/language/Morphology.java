package com.polyglot.domain.language;

import java.util.Optional;

/**
 * Grammatical features of one surface form. Every feature is optional: a {@code null} component
 * means "not applicable" for the word or the language.
 *
 * @param number singular or plural
 * @param gender grammatical gender
 * @param person grammatical person
 * @param tense verb tense
 */
public record Morphology(GrammaticalNumber number, Gender gender, Person person, Tense tense) {

    private static final Morphology NONE = new Morphology(null, null, null, null);

    /** Morphology with no feature set, e.g. for adverbs or untagged extraction results. */
    public static Morphology none() {
        return NONE;
    }

    public Morphology withNumber(GrammaticalNumber number) {
        return new Morphology(number, gender, person, tense);
    }

    public Morphology withGender(Gender gender) {
        return new Morphology(number, gender, person, tense);
    }

    public Morphology withPerson(Person person) {
        return new Morphology(number, gender, person, tense);
    }

    public Morphology withTense(Tense tense) {
        return new Morphology(number, gender, person, tense);
    }

    public Optional<Tense> tenseIfAny() {
        return Optional.ofNullable(tense);
    }

    public boolean isEmpty() {
        return number == null && gender == null && person == null && tense == null;
    }
}
