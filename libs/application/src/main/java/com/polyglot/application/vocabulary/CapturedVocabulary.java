package com.polyglot.application.vocabulary;

import com.polyglot.domain.vocabulary.VocabularyItemId;

import java.util.List;

/**
 * @param created items seen for the first time
 * @param updated existing items that got a new encounter
 */
public record CapturedVocabulary(List<VocabularyItemId> created, List<VocabularyItemId> updated) {

    public CapturedVocabulary {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
    }

    public int total() {
        return created.size() + updated.size();
    }
}
