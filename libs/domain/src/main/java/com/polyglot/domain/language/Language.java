package com.polyglot.domain.language;

import com.polyglot.domain.exception.ValidationException;
import java.util.Locale;
import java.util.Set;

/**
 * A language identified by its ISO 639-1 code.
 *
 * <p>The code is trimmed and lower-cased before validation, so {@code Language.of(" ES")} equals
 * {@code Language.of("es")}.
 *
 * @param code two-letter ISO 639-1 code
 */
public record Language(String code) {

    private static final Set<String> ISO_639_1 = Set.of(Locale.getISOLanguages());

    public Language {
        if (code == null) {
            throw new ValidationException("language", "code must not be null");
        }
        code = code.strip().toLowerCase(Locale.ROOT);
        if (!ISO_639_1.contains(code)) {
            throw new ValidationException(
                    "language", "'%s' is not an ISO 639-1 code".formatted(code));
        }
    }

    public static Language of(String code) {
        return new Language(code);
    }

    /** English display name, e.g. "Spanish" for {@code es}. */
    public String displayName() {
        return Locale.forLanguageTag(code).getDisplayLanguage(Locale.ENGLISH);
    }

    @Override
    public String toString() {
        return code;
    }
}
