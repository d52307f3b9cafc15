package com.polyglot.domain.vocabulary;

import com.polyglot.domain.AggregateRoot;
import com.polyglot.domain.conversation.Role;
import com.polyglot.domain.exception.InvalidReviewOutcomeException;
import com.polyglot.domain.exception.ValidationException;
import com.polyglot.domain.language.Language;
import com.polyglot.domain.language.Lexeme;
import com.polyglot.domain.user.UserId;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A lexeme a learner has met, with its review history.
 *
 * <p>There is one item per (user, lexeme). An item only exists once the lexeme was seen in a chat
 * message. Encounters are kept in message order, so capturing an older message after a newer one
 * moves the first encounter (and the source) back to the older message. Reviews are append-only.
 * Mastery and due date are never stored: call {@link #schedule(ReviewSchedulingPolicy)}.
 */
public final class VocabularyItem extends AggregateRoot<VocabularyItemId> {

    private final UserId ownerId;
    private final Lexeme lexeme;
    private final List<Encounter> encounters;
    private final List<ReviewEvent> reviews;
    private VocabularySource source;

    private VocabularyItem(
            VocabularyItemId id,
            UserId ownerId,
            Lexeme lexeme,
            VocabularySource source,
            List<Encounter> encounters,
            List<ReviewEvent> reviews,
            long version) {
        super(id, validatedFirstEncounter(encounters), version);
        if (ownerId == null) {
            throw new ValidationException("vocabulary.ownerId", "owner must not be null");
        }
        if (lexeme == null) {
            throw new ValidationException("vocabulary.lexeme", "lexeme must not be null");
        }
        if (source == null) {
            throw new ValidationException("vocabulary.source", "source must not be null");
        }
        this.ownerId = ownerId;
        this.lexeme = lexeme;
        this.source = source;
        this.encounters = new ArrayList<>(encounters);
        this.reviews = new ArrayList<>();
        for (ReviewEvent review : reviews) {
            append(review);
        }
    }

    /** Creates the item for a lexeme seen for the first time in {@code message}. */
    public static VocabularyItem firstEncounter(
            VocabularyItemId id, UserId ownerId, Lexeme lexeme, MessageReference message, Role role, Instant at) {
        return new VocabularyItem(
                id, ownerId, lexeme, VocabularySource.fromRole(role), List.of(new Encounter(message, at)), List.of(), 0);
    }

    /** Rebuilds a persisted item. Encounter and review order are revalidated. */
    public static VocabularyItem restore(
            VocabularyItemId id,
            UserId ownerId,
            Lexeme lexeme,
            VocabularySource source,
            List<Encounter> encounters,
            List<ReviewEvent> reviews,
            long version) {
        return new VocabularyItem(
                id, ownerId, lexeme, source, encounters, reviews == null ? List.of() : reviews, version);
    }

    /**
     * Records that the lexeme appeared in another message, sent by {@code role} at {@code at}.
     *
     * <p>An encounter older than the current first one becomes the first encounter, and the item's
     * source follows it.
     *
     * @return false when this message was already recorded
     */
    public boolean recordEncounter(MessageReference message, Role role, Instant at) {
        for (Encounter encounter : encounters) {
            if (encounter.message().equals(message)) {
                return false;
            }
        }
        Encounter encounter = new Encounter(message, at);
        int position = encounters.size();
        while (position > 0 && at.isBefore(encounters.get(position - 1).encounteredAt())) {
            position--;
        }
        if (position == 0) {
            source = VocabularySource.fromRole(role);
        }
        encounters.add(position, encounter);
        return true;
    }

    /**
     * Appends a review outcome.
     *
     * @throws InvalidReviewOutcomeException if {@code at} precedes the first encounter or the last
     *     review
     */
    public ReviewEvent recordReview(ReviewOutcome outcome, Instant at) {
        ReviewEvent event = new ReviewEvent(outcome, at);
        append(event);
        return event;
    }

    public ReviewSchedule schedule(ReviewSchedulingPolicy policy) {
        return policy.schedule(firstEncounteredAt(), reviews);
    }

    public boolean isDue(ReviewSchedulingPolicy policy, Instant asOf) {
        return schedule(policy).isDueAt(asOf);
    }

    public UserId ownerId() {
        return ownerId;
    }

    public Lexeme lexeme() {
        return lexeme;
    }

    public Language language() {
        return lexeme.language();
    }

    public VocabularySource source() {
        return source;
    }

    public Instant firstEncounteredAt() {
        return encounters.get(0).encounteredAt();
    }

    public MessageReference firstSeenIn() {
        return encounters.get(0).message();
    }

    public List<Encounter> encounters() {
        return Collections.unmodifiableList(encounters);
    }

    public List<ReviewEvent> reviews() {
        return Collections.unmodifiableList(reviews);
    }

    public Optional<Instant> lastReviewedAt() {
        return reviews.isEmpty() ? Optional.empty() : Optional.of(reviews.get(reviews.size() - 1).reviewedAt());
    }

    private void append(ReviewEvent event) {
        if (event.reviewedAt().isBefore(firstEncounteredAt())) {
            throw new InvalidReviewOutcomeException(
                    lexeme.surfaceForm(),
                    "review at %s precedes first encounter at %s".formatted(event.reviewedAt(), firstEncounteredAt()));
        }
        Optional<Instant> last = lastReviewedAt();
        if (last.isPresent() && event.reviewedAt().isBefore(last.get())) {
            throw new InvalidReviewOutcomeException(
                    lexeme.surfaceForm(),
                    "review at %s precedes previous review at %s".formatted(event.reviewedAt(), last.get()));
        }
        reviews.add(event);
    }

    private static Instant validatedFirstEncounter(List<Encounter> encounters) {
        if (encounters == null || encounters.isEmpty()) {
            throw new InvalidReviewOutcomeException(
                    "vocabulary item", "an item must be created from at least one message encounter");
        }
        Set<MessageReference> seen = new HashSet<>();
        Encounter previous = null;
        for (Encounter encounter : encounters) {
            if (encounter == null) {
                throw new ValidationException("vocabulary.encounters", "encounters must not contain null");
            }
            if (!seen.add(encounter.message())) {
                throw new ValidationException(
                        "vocabulary.encounters",
                        "message %s is recorded more than once".formatted(encounter.message().messageId()));
            }
            if (previous != null && encounter.encounteredAt().isBefore(previous.encounteredAt())) {
                throw new ValidationException(
                        "vocabulary.encounters",
                        "encounter at %s precedes previous encounter at %s"
                                .formatted(encounter.encounteredAt(), previous.encounteredAt()));
            }
            previous = encounter;
        }
        return encounters.get(0).encounteredAt();
    }
}
