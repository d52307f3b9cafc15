package com.polyglot.domain.port;

import com.polyglot.domain.conversation.TutorProfile;
import com.polyglot.domain.exception.PortTimeoutException;
import com.polyglot.domain.exception.PortUnavailableException;
import com.polyglot.domain.exception.ProviderException;
import com.polyglot.domain.language.Language;
import java.util.List;

/**
 * AI tutor capability.
 *
 * <p>Both operations may fail with {@link ProviderException}, {@link PortTimeoutException} or {@link
 * PortUnavailableException}. Callers surface these and never retry silently.
 */
public interface AiTutor {

    /** Content of the assistant's next message. */
    String generateReply(ConversationContext context, TutorProfile profile);

    /** Lexemes occurring in {@code text}, in order of appearance. Duplicates allowed. */
    List<LexemeOccurrence> extractVocabulary(String text, Language language);
}
