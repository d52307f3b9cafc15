package com.polyglot.domain.conversation;

import com.polyglot.domain.AggregateRoot;
import com.polyglot.domain.exception.ConversationNotActiveException;
import com.polyglot.domain.exception.InvalidStateTransitionException;
import com.polyglot.domain.exception.ValidationException;
import com.polyglot.domain.language.Language;
import com.polyglot.domain.user.UserId;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A tutoring conversation and the messages it owns.
 *
 * <p>Invariants:
 *
 * <ul>
 *   <li>status only moves along {@link ConversationStatus#allowedTransitions()}
 *   <li>messages are appended only while ACTIVE
 *   <li>message timestamps never decrease
 *   <li>last activity is never earlier than the start or the last message
 *   <li>the tutor profile and language pair are fixed at start
 * </ul>
 *
 * <p>Archiving and deleting never drop message history.
 */
public final class Conversation extends AggregateRoot<ConversationId> {

    public static final int MAX_TITLE_LENGTH = 100;
    public static final String DEFAULT_TITLE = "Conversation";

    private final UserId ownerId;
    private final Language nativeLanguage;
    private final Language targetLanguage;
    private final TutorProfile tutorProfile;
    private final List<ChatMessage> messages;
    private String title;
    private ConversationStatus status;
    private Instant lastActivityAt;

    private Conversation(
            ConversationId id,
            UserId ownerId,
            String title,
            Language nativeLanguage,
            Language targetLanguage,
            TutorProfile tutorProfile,
            ConversationStatus status,
            List<ChatMessage> messages,
            Instant createdAt,
            Instant lastActivityAt,
            long version) {
        super(id, createdAt, version);
        if (ownerId == null) {
            throw new ValidationException("conversation.ownerId", "owner must not be null");
        }
        if (nativeLanguage == null || targetLanguage == null) {
            throw new ValidationException("conversation.languages", "language pair must not be null");
        }
        if (nativeLanguage.equals(targetLanguage)) {
            throw new ValidationException(
                    "conversation.languages",
                    "target language must differ from native language '%s'".formatted(nativeLanguage));
        }
        if (tutorProfile == null) {
            throw new ValidationException("conversation.tutorProfile", "tutor profile must not be null");
        }
        if (status == null) {
            throw new ValidationException("conversation.status", "status must not be null");
        }
        this.ownerId = ownerId;
        this.title = normalizeTitle(title);
        this.nativeLanguage = nativeLanguage;
        this.targetLanguage = targetLanguage;
        this.tutorProfile = tutorProfile;
        this.status = status;
        this.messages = new ArrayList<>();
        this.lastActivityAt = lastActivityAt == null ? createdAt : lastActivityAt;
        for (ChatMessage message : messages) {
            requireChronological(message.createdAt());
            this.messages.add(message);
        }
        if (this.lastActivityAt.isBefore(createdAt)) {
            throw new ValidationException(
                    "conversation.lastActivityAt",
                    "last activity at %s precedes conversation start %s".formatted(this.lastActivityAt, createdAt));
        }
        Optional<ChatMessage> last = lastMessage();
        if (last.isPresent() && this.lastActivityAt.isBefore(last.get().createdAt())) {
            throw new ValidationException(
                    "conversation.lastActivityAt",
                    "last activity at %s precedes last message at %s"
                            .formatted(this.lastActivityAt, last.get().createdAt()));
        }
    }

    /**
     * Starts a new ACTIVE conversation.
     *
     * @param title free text; {@code null} or blank falls back to {@value #DEFAULT_TITLE}
     */
    public static Conversation start(
            ConversationId id,
            UserId ownerId,
            String title,
            Language nativeLanguage,
            Language targetLanguage,
            TutorProfile tutorProfile,
            Instant now) {
        String effectiveTitle = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        return new Conversation(
                id,
                ownerId,
                effectiveTitle,
                nativeLanguage,
                targetLanguage,
                tutorProfile,
                ConversationStatus.ACTIVE,
                List.of(),
                now,
                now,
                0);
    }

    /** Rebuilds a persisted conversation. Message order is revalidated. */
    public static Conversation restore(
            ConversationId id,
            UserId ownerId,
            String title,
            Language nativeLanguage,
            Language targetLanguage,
            TutorProfile tutorProfile,
            ConversationStatus status,
            List<ChatMessage> messages,
            Instant createdAt,
            Instant lastActivityAt,
            long version) {
        return new Conversation(
                id,
                ownerId,
                title,
                nativeLanguage,
                targetLanguage,
                tutorProfile,
                status,
                messages == null ? List.of() : messages,
                createdAt,
                lastActivityAt,
                version);
    }

    /**
     * Appends a message.
     *
     * @throws ConversationNotActiveException if the conversation is ARCHIVED or DELETED
     * @throws ValidationException if the content is blank or {@code at} precedes the last message
     */
    public ChatMessage appendMessage(MessageId messageId, Role role, String content, Instant at) {
        requireActive();
        ChatMessage message = ChatMessage.create(messageId, role, content, at);
        requireChronological(at);
        for (ChatMessage existing : messages) {
            if (existing.id().equals(messageId)) {
                throw new ValidationException(
                        "message.id", "message '%s' already exists in conversation '%s'".formatted(messageId, id()));
            }
        }
        messages.add(message);
        touch(at);
        return message;
    }

    /** @throws ConversationNotActiveException unless the status is ACTIVE */
    public void requireActive() {
        if (!status.acceptsMessages()) {
            throw new ConversationNotActiveException(id().toString(), status.name());
        }
    }

    public void archive(Instant now) {
        transitionTo(ConversationStatus.ARCHIVED, now);
    }

    public void reactivate(Instant now) {
        transitionTo(ConversationStatus.ACTIVE, now);
    }

    /** Soft delete. Terminal. */
    public void delete(Instant now) {
        transitionTo(ConversationStatus.DELETED, now);
    }

    /** Changes the title of an ACTIVE conversation. */
    public void rename(String newTitle, Instant now) {
        requireActive();
        this.title = normalizeTitle(newTitle);
        touch(now);
    }

    public boolean isOwnedBy(UserId userId) {
        return ownerId.equals(userId);
    }

    public Optional<ChatMessage> findMessage(MessageId messageId) {
        return messages.stream().filter(m -> m.id().equals(messageId)).findFirst();
    }

    public Optional<ChatMessage> lastMessage() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    public int messageCount() {
        return messages.size();
    }

    /** Read-only view in append order. */
    public List<ChatMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public UserId ownerId() {
        return ownerId;
    }

    public String title() {
        return title;
    }

    public Language nativeLanguage() {
        return nativeLanguage;
    }

    public Language targetLanguage() {
        return targetLanguage;
    }

    public TutorProfile tutorProfile() {
        return tutorProfile;
    }

    public ConversationStatus status() {
        return status;
    }

    public Instant lastActivityAt() {
        return lastActivityAt;
    }

    private void transitionTo(ConversationStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id().toString(), status.name(), target.name());
        }
        status = target;
        touch(now);
    }

    private void requireChronological(Instant at) {
        if (at.isBefore(createdAt())) {
            throw new ValidationException(
                    "message.createdAt",
                    "message at %s precedes conversation start %s".formatted(at, createdAt()));
        }
        Optional<ChatMessage> last = lastMessage();
        if (last.isPresent() && at.isBefore(last.get().createdAt())) {
            throw new ValidationException(
                    "message.createdAt",
                    "message at %s precedes previous message at %s".formatted(at, last.get().createdAt()));
        }
    }

    private void touch(Instant now) {
        if (now != null && now.isAfter(lastActivityAt)) {
            lastActivityAt = now;
        }
    }

    private static String normalizeTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("conversation.title", "title must not be blank");
        }
        String trimmed = title.strip();
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException(
                    "conversation.title",
                    "title exceeds %d characters".formatted(MAX_TITLE_LENGTH));
        }
        return trimmed;
    }
}
