package com.polyglot.domain.testing;

import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.MessageId;
import com.polyglot.domain.conversation.Role;
import com.polyglot.domain.conversation.TutorProfile;
import com.polyglot.domain.language.CefrLevel;
import com.polyglot.domain.language.Language;
import com.polyglot.domain.language.Lemma;
import com.polyglot.domain.language.Lexeme;
import com.polyglot.domain.language.PartOfSpeech;
import com.polyglot.domain.user.User;
import com.polyglot.domain.user.UserId;
import com.polyglot.domain.vocabulary.MessageReference;
import com.polyglot.domain.vocabulary.VocabularyItem;
import com.polyglot.domain.vocabulary.VocabularyItemId;

import java.time.Instant;

/**
 * Ready-made learners, conversations and vocabulary for tests.
 * <p>
 * WHY in src/main: the application module's tests import it through a regular Maven dependency,
 * the same way they import the in-memory ports.
 */
public final class TutoringFixtures {

    public static final Language ENGLISH = Language.of("en");
    public static final Language SPANISH = Language.of("es");
    public static final Language FRENCH = Language.of("fr");

    /** Fixed starting instant for clocks and factories. */
    public static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private TutoringFixtures() {
        // utility class
    }

    /** An English speaker learning Spanish at A2, registered at {@link #T0}. */
    public static User learner() {
        return User.register(UserId.generate(), ENGLISH, SPANISH, CefrLevel.A2, T0);
    }

    /** An ACTIVE conversation with default tutor profile, started at {@link #T0}. */
    public static Conversation conversationOf(User learner) {
        return Conversation.start(
                ConversationId.generate(),
                learner.id(),
                "Practice",
                learner.nativeLanguage(),
                learner.targetLanguage(),
                TutorProfile.defaults(),
                T0);
    }

    /** A Spanish noun in its dictionary form, e.g. {@code spanishNoun("casa")}. */
    public static Lexeme spanishNoun(String term) {
        return Lexeme.ofLemma(Lemma.of(term, PartOfSpeech.NOUN, SPANISH));
    }

    /** A vocabulary item first seen at {@code at} in a tutor message of some conversation. */
    public static VocabularyItem vocabularyItem(UserId owner, Lexeme lexeme, Instant at) {
        return VocabularyItem.firstEncounter(
                VocabularyItemId.generate(),
                owner,
                lexeme,
                new MessageReference(ConversationId.generate(), MessageId.generate()),
                Role.ASSISTANT,
                at);
    }
}
