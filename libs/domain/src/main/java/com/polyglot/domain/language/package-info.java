/**
 * Language and linguistics value objects: {@link com.polyglot.domain.language.Language}, {@link
 * com.polyglot.domain.language.CefrLevel} and the lemma/lexeme annotation model.
 *
 * <p>All types are immutable records or enums compared by value. Construction validates eagerly
 * and fails with {@link com.polyglot.domain.exception.ValidationException}.
 */
package com.polyglot.domain.language;
