package com.polyglot.domain.language;

/** Grammatical gender. NEUTRAL also covers languages without gender. */
public enum Gender {
    MASCULINE,
    FEMININE,
    NEUTRAL
}
