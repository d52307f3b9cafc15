package com.polyglot.application.user;

import com.polyglot.application.QueryHandler;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.conversation.ConversationStatus;
import com.polyglot.domain.port.ConversationRepository;
import com.polyglot.domain.port.UserRepository;
import com.polyglot.domain.port.VocabularyRepository;
import com.polyglot.domain.user.User;
import com.polyglot.domain.vocabulary.MasteryTier;
import com.polyglot.domain.vocabulary.ReviewSchedule;
import com.polyglot.domain.vocabulary.ReviewSchedulingPolicy;
import com.polyglot.domain.vocabulary.VocabularyItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/** Builds the learner overview shown on a dashboard. */
public final class GetUserSummaryHandler implements QueryHandler<GetUserSummaryQuery, UserSummary> {

    private static final Logger log = LoggerFactory.getLogger(GetUserSummaryHandler.class);

    private final UserRepository users;
    private final ConversationRepository conversations;
    private final VocabularyRepository vocabulary;
    private final ReviewSchedulingPolicy policy;

    public GetUserSummaryHandler(
            UserRepository users,
            ConversationRepository conversations,
            VocabularyRepository vocabulary,
            ReviewSchedulingPolicy policy) {
        this.users = users;
        this.conversations = conversations;
        this.vocabulary = vocabulary;
        this.policy = policy;
    }

    @Override
    public UserSummary handle(GetUserSummaryQuery query) {
        return UseCaseLogContext.call("GetUserSummary", query.userId(), null, () -> {
            User user = users.get(query.userId());
            List<Conversation> owned = conversations.listByUser(
                    user.id(), EnumSet.of(ConversationStatus.ACTIVE, ConversationStatus.ARCHIVED));
            long active = owned.stream().filter(c -> c.status() == ConversationStatus.ACTIVE).count();

            Map<MasteryTier, Long> byTier = new EnumMap<>(MasteryTier.class);
            for (MasteryTier tier : MasteryTier.values()) {
                byTier.put(tier, 0L);
            }
            int due = 0;
            List<VocabularyItem> items = vocabulary.listByUser(user.id());
            for (VocabularyItem item : items) {
                ReviewSchedule schedule = item.schedule(policy);
                byTier.merge(schedule.tier(), 1L, Long::sum);
                if (schedule.isDueAt(query.asOf())) {
                    due++;
                }
            }
            log.debug("Summary for user {}: {} conversations, {} vocabulary items", user.id(), owned.size(), items.size());
            return new UserSummary(
                    user.id(),
                    user.nativeLanguage(),
                    user.targetLanguage(),
                    user.currentLevel(),
                    user.levels(),
                    active,
                    owned.size() - active,
                    items.size(),
                    due,
                    byTier);
        });
    }
}
