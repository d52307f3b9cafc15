package com.polyglot.application.user;

import com.polyglot.domain.language.CefrLevel;
import com.polyglot.domain.language.Language;
import com.polyglot.domain.user.UserId;
import com.polyglot.domain.vocabulary.MasteryTier;

import java.util.Map;

/**
 * Learner profile with activity counters.
 *
 * @param levels last assessed level of every language studied so far
 * @param vocabularyByTier number of vocabulary items per mastery tier, every tier present
 */
public record UserSummary(
        UserId userId,
        Language nativeLanguage,
        Language targetLanguage,
        CefrLevel currentLevel,
        Map<Language, CefrLevel> levels,
        long activeConversations,
        long archivedConversations,
        int vocabularySize,
        int dueVocabulary,
        Map<MasteryTier, Long> vocabularyByTier) {

    public UserSummary {
        levels = Map.copyOf(levels);
        vocabularyByTier = Map.copyOf(vocabularyByTier);
    }
}
