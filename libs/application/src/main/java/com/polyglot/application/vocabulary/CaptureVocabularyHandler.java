package com.polyglot.application.vocabulary;

import com.polyglot.application.CommandHandler;
import com.polyglot.application.support.ConflictRetry;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.ChatMessage;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.exception.NotFoundException;
import com.polyglot.domain.language.Lexeme;
import com.polyglot.domain.port.AiTutor;
import com.polyglot.domain.port.ConversationRepository;
import com.polyglot.domain.port.LexemeOccurrence;
import com.polyglot.domain.port.VocabularyRepository;
import com.polyglot.domain.vocabulary.MessageReference;
import com.polyglot.domain.vocabulary.VocabularyItem;
import com.polyglot.domain.vocabulary.VocabularyItemId;
import com.polyglot.domain.vocabulary.VocabularySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the lexemes of a chat message into vocabulary items.
 *
 * <p>The AI tutor extracts lexemes in the conversation's target language. Each distinct lexeme
 * either creates an item, with the message as first encounter, or adds the message to the
 * existing item's encounters in message order. Every item is its own aggregate and is saved, and
 * retried on conflict, on its own. Capturing the same message twice changes nothing.
 */
public final class CaptureVocabularyHandler implements CommandHandler<CaptureVocabularyCommand, CapturedVocabulary> {

    private static final Logger log = LoggerFactory.getLogger(CaptureVocabularyHandler.class);

    private final ConversationRepository conversations;
    private final VocabularyRepository vocabulary;
    private final AiTutor tutor;

    public CaptureVocabularyHandler(
            ConversationRepository conversations, VocabularyRepository vocabulary, AiTutor tutor) {
        this.conversations = conversations;
        this.vocabulary = vocabulary;
        this.tutor = tutor;
    }

    @Override
    public CapturedVocabulary handle(CaptureVocabularyCommand command) {
        return UseCaseLogContext.call("CaptureVocabulary", null, command.conversationId(), () -> {
            Conversation conversation = conversations.get(command.conversationId());
            ChatMessage message = conversation.findMessage(command.messageId())
                    .orElseThrow(() -> new NotFoundException("ChatMessage", command.messageId().toString()));
            VocabularySource source = VocabularySource.fromRole(message.role());

            List<LexemeOccurrence> occurrences = tutor.extractVocabulary(message.content(), conversation.targetLanguage());
            log.debug("Tutor extracted {} occurrences from {} message {}", occurrences.size(), source, message.id());

            Set<Lexeme> lexemes = new LinkedHashSet<>();
            for (LexemeOccurrence occurrence : occurrences) {
                if (occurrence.lexeme().language().equals(conversation.targetLanguage())) {
                    lexemes.add(occurrence.lexeme());
                }
            }

            MessageReference reference = new MessageReference(conversation.id(), message.id());
            List<VocabularyItemId> created = new ArrayList<>();
            List<VocabularyItemId> updated = new ArrayList<>();
            for (Lexeme lexeme : lexemes) {
                ConflictRetry.retryOnce("CaptureVocabulary", () -> {
                    Optional<VocabularyItem> existing = vocabulary.find(conversation.ownerId(), lexeme);
                    if (existing.isPresent()) {
                        VocabularyItem item = existing.get();
                        if (item.recordEncounter(reference, message.role(), message.createdAt())) {
                            vocabulary.save(item);
                            updated.add(item.id());
                        }
                    } else {
                        VocabularyItem item = VocabularyItem.firstEncounter(
                                VocabularyItemId.generate(),
                                conversation.ownerId(),
                                lexeme,
                                reference,
                                message.role(),
                                message.createdAt());
                        vocabulary.save(item);
                        created.add(item.id());
                    }
                });
            }
            log.info("Captured vocabulary from message {}: {} new, {} updated",
                    message.id(), created.size(), updated.size());
            return new CapturedVocabulary(created, updated);
        });
    }
}
