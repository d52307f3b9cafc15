package com.polyglot.application.conversation;

import com.polyglot.application.QueryHandler;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.conversation.Conversation;
import com.polyglot.domain.port.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/** Pages through a learner's conversations, most recently started first. */
public final class ListConversationsHandler implements QueryHandler<ListConversationsQuery, List<ConversationSummary>> {

    private static final Logger log = LoggerFactory.getLogger(ListConversationsHandler.class);

    private static final Comparator<Conversation> NEWEST_FIRST = Comparator
            .comparing(Conversation::createdAt)
            .thenComparing(c -> c.id().value())
            .reversed();

    private final ConversationRepository conversations;

    public ListConversationsHandler(ConversationRepository conversations) {
        this.conversations = conversations;
    }

    @Override
    public List<ConversationSummary> handle(ListConversationsQuery query) {
        return UseCaseLogContext.call("ListConversations", query.userId(), null, () -> {
            List<ConversationSummary> page = conversations.listByUser(query.userId(), query.statusFilter()).stream()
                    .sorted(NEWEST_FIRST)
                    .skip(query.offset())
                    .limit(query.limit())
                    .map(ConversationSummary::of)
                    .toList();
            log.debug("Listed {} conversations (offset {}, limit {})", page.size(), query.offset(), query.limit());
            return page;
        });
    }
}
