package com.polyglot.application.user;

import com.polyglot.domain.language.CefrLevel;
import com.polyglot.domain.language.Language;
import com.polyglot.domain.user.UserId;

/**
 * Changes the language a learner studies.
 *
 * @param startingLevel used only when the learner never studied {@code newTarget} before
 */
public record SwitchTargetLanguageCommand(UserId userId, Language newTarget, CefrLevel startingLevel) {
}
