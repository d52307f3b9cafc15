package com.polyglot.domain.language;

public enum Tense {
    PRESENT,
    PAST_SIMPLE,
    PAST_COMPOUND,
    IMPERFECT,
    PRESENT_PERFECT,
    PAST_PERFECT,
    FUTURE,
    FUTURE_PERFECT,
    CONDITIONAL,
    SUBJUNCTIVE,
    IMPERATIVE
}
