package com.polyglot.domain.vocabulary;

import java.util.Objects;
import java.util.UUID;

/** Vocabulary item identifier (Value Object). */
public record VocabularyItemId(UUID value) {

    public VocabularyItemId {
        Objects.requireNonNull(value, "VocabularyItemId value cannot be null");
    }

    public static VocabularyItemId generate() {
        return new VocabularyItemId(UUID.randomUUID());
    }

    public static VocabularyItemId of(String value) {
        return new VocabularyItemId(UUID.fromString(value));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
