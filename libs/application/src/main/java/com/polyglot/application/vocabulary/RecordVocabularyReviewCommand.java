package com.polyglot.application.vocabulary;

import com.polyglot.domain.language.Lexeme;
import com.polyglot.domain.user.UserId;
import com.polyglot.domain.vocabulary.ReviewOutcome;

public record RecordVocabularyReviewCommand(UserId userId, Lexeme lexeme, ReviewOutcome outcome) {
}
