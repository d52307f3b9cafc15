package com.polyglot.domain.port;

import com.polyglot.domain.exception.ValidationException;
import com.polyglot.domain.language.Lexeme;

/**
 * A lexeme found in a text.
 *
 * @param position zero-based character offset of the surface form in the analysed text
 */
public record LexemeOccurrence(Lexeme lexeme, int position) {

    public LexemeOccurrence {
        if (lexeme == null) {
            throw new ValidationException("occurrence.lexeme", "lexeme must not be null");
        }
        if (position < 0) {
            throw new ValidationException("occurrence.position", "position must be >= 0, was " + position);
        }
    }
}
