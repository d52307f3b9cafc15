package com.polyglot.domain.conversation;

/** Pedagogical approach the tutor takes when answering. */
public enum GenerationStyle {
    /** Exercises and drills. */
    PRACTICE,
    /** Detailed explanations. */
    EXPLANATORY,
    /** Emphasis on correcting mistakes. */
    CORRECTIVE,
    /** Natural dialogue. */
    CONVERSATIONAL
}
