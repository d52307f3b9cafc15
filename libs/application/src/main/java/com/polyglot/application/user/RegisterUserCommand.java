package com.polyglot.application.user;

import com.polyglot.domain.language.CefrLevel;
import com.polyglot.domain.language.Language;

/** Registers a learner. */
public record RegisterUserCommand(Language nativeLanguage, Language targetLanguage, CefrLevel startingLevel) {
}
