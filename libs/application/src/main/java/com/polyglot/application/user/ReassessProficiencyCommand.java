package com.polyglot.application.user;

import com.polyglot.domain.language.CefrLevel;
import com.polyglot.domain.user.UserId;

/** Records an assessed level in the learner's current target language. */
public record ReassessProficiencyCommand(UserId userId, CefrLevel newLevel) {
}
