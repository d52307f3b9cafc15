package com.polyglot.domain.vocabulary;

import com.polyglot.domain.conversation.Role;
import com.polyglot.domain.exception.ValidationException;

/** Who introduced a vocabulary item into the learner's history. */
public enum VocabularySource {
    /** The learner used the word. */
    LEARNER,
    /** The tutor used the word. */
    TUTOR;

    public static VocabularySource fromRole(Role role) {
        if (role == null) {
            throw new ValidationException("vocabulary.source", "role must not be null");
        }
        return switch (role) {
            case USER -> LEARNER;
            case ASSISTANT -> TUTOR;
            case SYSTEM -> throw new ValidationException(
                    "vocabulary.source", "vocabulary cannot be captured from system messages");
        };
    }
}
