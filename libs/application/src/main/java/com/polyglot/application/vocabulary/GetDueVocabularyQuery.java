package com.polyglot.application.vocabulary;

import com.polyglot.domain.user.UserId;

import java.time.Instant;

public record GetDueVocabularyQuery(UserId userId, Instant asOf) {
}
