package com.polyglot.domain.language;

/** Word classes used to tag lemmas. */
public enum PartOfSpeech {
    NOUN,
    VERB,
    ADJ,
    ADV,
    PRON,
    PREP,
    CONJ,
    DET,
    INTJ,
    NUM,
    /** Multi-word expression. */
    PHRASE,
    IDIOM,
    UNKNOWN
}
