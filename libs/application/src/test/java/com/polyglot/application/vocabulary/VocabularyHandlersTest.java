package com.polyglot.application.vocabulary;

import static com.polyglot.domain.testing.TutoringFixtures.T0;
import static com.polyglot.domain.testing.TutoringFixtures.learner;
import static com.polyglot.domain.testing.TutoringFixtures.spanishNoun;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.polyglot.application.conversation.SendMessageCommand;
import com.polyglot.application.conversation.SendMessageHandler;
import com.polyglot.application.conversation.SendMessageResult;
import com.polyglot.application.conversation.StartConversationCommand;
import com.polyglot.application.conversation.StartConversationHandler;
import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.conversation.MessageId;
import com.polyglot.domain.conversation.Role;
import com.polyglot.domain.exception.ErrorKind;
import com.polyglot.domain.exception.InvalidReviewOutcomeException;
import com.polyglot.domain.exception.NotFoundException;
import com.polyglot.domain.exception.ProviderException;
import com.polyglot.domain.exception.ValidationException;
import com.polyglot.domain.language.Lexeme;
import com.polyglot.domain.testing.InMemoryConversationRepository;
import com.polyglot.domain.testing.InMemoryUserRepository;
import com.polyglot.domain.testing.InMemoryVocabularyRepository;
import com.polyglot.domain.testing.MutableClock;
import com.polyglot.domain.testing.ScriptedAiTutor;
import com.polyglot.domain.user.User;
import com.polyglot.domain.vocabulary.MasteryTier;
import com.polyglot.domain.vocabulary.ReviewOutcome;
import com.polyglot.domain.vocabulary.ReviewSchedulingPolicy;
import com.polyglot.domain.vocabulary.VocabularySource;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Vocabulary use cases")
class VocabularyHandlersTest {

    private final ReviewSchedulingPolicy policy = ReviewSchedulingPolicy.defaults();
    private final Lexeme casa = spanishNoun("casa");
    private final Lexeme perro = spanishNoun("perro");

    private InMemoryUserRepository users;
    private InMemoryConversationRepository conversations;
    private InMemoryVocabularyRepository vocabulary;
    private ScriptedAiTutor tutor;
    private MutableClock clock;
    private User learner;
    private ConversationId conversationId;
    private SendMessageResult exchange;

    @BeforeEach
    void setUp() {
        users = new InMemoryUserRepository();
        conversations = new InMemoryConversationRepository();
        vocabulary = new InMemoryVocabularyRepository();
        tutor = new ScriptedAiTutor().knows(casa, perro);
        clock = new MutableClock(T0);
        learner = learner();
        users.save(learner);

        conversationId = new StartConversationHandler(users, conversations, clock)
                .handle(new StartConversationCommand(learner.id(), null));
        tutor.replyWith("Tu casa tiene un perro?");
        exchange = new SendMessageHandler(conversations, users, tutor, clock)
                .handle(new SendMessageCommand(conversationId, Role.USER, "Mi casa es grande, casa!"));
    }

    private CaptureVocabularyHandler capture() {
        return new CaptureVocabularyHandler(conversations, vocabulary, tutor);
    }

    private void review(Lexeme lexeme, ReviewOutcome outcome) {
        new RecordVocabularyReviewHandler(vocabulary, clock)
                .handle(new RecordVocabularyReviewCommand(learner.id(), lexeme, outcome));
    }

    @Nested
    @DisplayName("CaptureVocabulary")
    class Capture {

        @Test
        @DisplayName("creates one item per distinct lexeme, sourced from the learner")
        void createsDistinct() {
            var captured = capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));

            assertThat(captured.created()).hasSize(1);
            assertThat(captured.updated()).isEmpty();
            var item = vocabulary.get(learner.id(), casa);
            assertThat(item.source()).isEqualTo(VocabularySource.LEARNER);
            assertThat(item.firstSeenIn().messageId()).isEqualTo(exchange.messageId());
            assertThat(tutor.analysedTexts()).containsExactly("Mi casa es grande, casa!");
        }

        @Test
        @DisplayName("a later message adds an encounter to existing items and creates new ones")
        void updatesExisting() {
            capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));

            var captured = capture().handle(new CaptureVocabularyCommand(conversationId, exchange.replyId()));

            assertThat(captured.created()).hasSize(1);
            assertThat(captured.updated()).containsExactly(vocabulary.get(learner.id(), casa).id());
            assertThat(vocabulary.get(learner.id(), casa).encounters()).hasSize(2);
            assertThat(vocabulary.get(learner.id(), perro).source()).isEqualTo(VocabularySource.TUTOR);
        }

        @Test
        @DisplayName("capturing a newer message before an older one still dates the item from the older")
        void olderMessageCapturedLast() {
            clock.advance(Duration.ofDays(10));
            var later = new SendMessageHandler(conversations, users, tutor, clock)
                    .handle(new SendMessageCommand(conversationId, Role.USER, "Otra casa"));

            capture().handle(new CaptureVocabularyCommand(conversationId, later.messageId()));
            var captured = capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));

            var item = vocabulary.get(learner.id(), casa);
            assertThat(captured.updated()).containsExactly(item.id());
            assertThat(item.firstSeenIn().messageId()).isEqualTo(exchange.messageId());
            assertThat(item.firstEncounteredAt()).isEqualTo(T0);
            assertThat(item.encounters()).extracting(e -> e.message().messageId())
                    .containsExactly(exchange.messageId(), later.messageId());
            assertThat(item.schedule(policy).nextDueAt()).isEqualTo(T0.plus(Duration.ofDays(1)));
        }

        @Test
        @DisplayName("capturing the same message twice changes nothing")
        void idempotent() {
            capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));
            int saves = vocabulary.saveCount();

            var again = capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));

            assertThat(again.total()).isZero();
            assertThat(vocabulary.saveCount()).isEqualTo(saves);
        }

        @Test
        @DisplayName("an unknown message surfaces NotFoundException")
        void unknownMessage() {
            assertThatThrownBy(() -> capture().handle(new CaptureVocabularyCommand(conversationId, MessageId.generate())))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("system messages are rejected before calling the tutor")
        void systemMessage() {
            var system = new SendMessageHandler(conversations, users, tutor, clock)
                    .handle(new SendMessageCommand(conversationId, Role.SYSTEM, "casa"));

            assertThatThrownBy(() -> capture().handle(new CaptureVocabularyCommand(conversationId, system.messageId())))
                    .isInstanceOf(ValidationException.class);
            assertThat(tutor.analysedTexts()).isEmpty();
        }

        @Test
        @DisplayName("an extraction failure propagates and nothing is saved")
        void providerFailure() {
            tutor.failNextCallWith(new ProviderException("extractVocabulary", "unavailable"));

            assertThatThrownBy(() -> capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId())))
                    .isInstanceOf(ProviderException.class);
            assertThat(vocabulary.saveCount()).isZero();
        }
    }

    @Nested
    @DisplayName("RecordVocabularyReview")
    class RecordReview {

        @Test
        @DisplayName("reviewing a never-seen lexeme fails with InvalidReviewOutcomeException")
        void neverSeen() {
            assertThatThrownBy(() -> review(casa, ReviewOutcome.INCORRECT))
                    .isInstanceOf(InvalidReviewOutcomeException.class)
                    .hasMessageContaining("casa")
                    .extracting(e -> ((InvalidReviewOutcomeException) e).kind())
                    .isEqualTo(ErrorKind.INVALID_REVIEW_OUTCOME);
            assertThat(vocabulary.listByUser(learner.id())).isEmpty();
        }

        @Test
        @DisplayName("three consecutive CORRECT reviews strictly increase the interval")
        void threeCorrect() {
            capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));

            Duration previous = vocabulary.get(learner.id(), casa).schedule(policy).interval();
            for (int i = 0; i < 3; i++) {
                clock.advance(Duration.ofDays(1));
                review(casa, ReviewOutcome.CORRECT);
                Duration current = vocabulary.get(learner.id(), casa).schedule(policy).interval();
                assertThat(current).isGreaterThan(previous);
                previous = current;
            }
            assertThat(vocabulary.get(learner.id(), casa).schedule(policy).tier()).isEqualTo(MasteryTier.FAMILIAR);
        }

        @Test
        @DisplayName("retries once when another writer saved the item first")
        void conflict() {
            capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));
            vocabulary.conflictOnNextSave();

            review(casa, ReviewOutcome.CORRECT);

            assertThat(vocabulary.get(learner.id(), casa).reviews()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("GetDueVocabulary")
    class GetDue {

        @Test
        @DisplayName("returns the same set until the clock crosses a due boundary")
        void stableUntilBoundary() {
            capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));
            capture().handle(new CaptureVocabularyCommand(conversationId, exchange.replyId()));
            var handler = new GetDueVocabularyHandler(vocabulary, policy);
            Instant beforeDue = T0.plus(Duration.ofHours(23));

            var first = handler.handle(new GetDueVocabularyQuery(learner.id(), beforeDue));
            var second = handler.handle(new GetDueVocabularyQuery(learner.id(), beforeDue));
            var afterBoundary = handler.handle(new GetDueVocabularyQuery(learner.id(), T0.plus(Duration.ofDays(1))));

            assertThat(first).isEmpty();
            assertThat(second).isEqualTo(first);
            assertThat(afterBoundary).extracting(VocabularyReadModel::surfaceForm).containsExactlyInAnyOrder("casa", "perro");
            assertThat(afterBoundary).allSatisfy(m -> {
                assertThat(m.tier()).isEqualTo(MasteryTier.NEW);
                assertThat(m.lastReviewedAt()).isNull();
            });
        }

        @Test
        @DisplayName("a correct review moves the item out of the due list")
        void reviewedItemNotDue() {
            capture().handle(new CaptureVocabularyCommand(conversationId, exchange.messageId()));
            clock.advance(Duration.ofDays(1));
            review(casa, ReviewOutcome.CORRECT);
            int saves = vocabulary.saveCount();

            var due = new GetDueVocabularyHandler(vocabulary, policy)
                    .handle(new GetDueVocabularyQuery(learner.id(), clock.instant().plus(Duration.ofDays(1))));

            assertThat(due).isEmpty();
            assertThat(vocabulary.saveCount()).isEqualTo(saves);
        }
    }
}
