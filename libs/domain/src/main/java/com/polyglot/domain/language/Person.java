package com.polyglot.domain.language;

/** Grammatical person for pronouns and conjugated verbs. */
public enum Person {
    FIRST,
    SECOND,
    THIRD
}
