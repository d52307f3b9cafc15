package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.ConversationStatus;
import com.polyglot.domain.exception.ValidationException;
import com.polyglot.domain.user.UserId;

import java.util.EnumSet;
import java.util.Set;

/**
 * One page of a learner's conversations, newest first.
 *
 * @param statusFilter statuses to include; empty means ACTIVE and ARCHIVED, deleted conversations
 *     are listed only when asked for explicitly
 * @param limit page size, 1 to {@value #MAX_LIMIT}
 * @param offset number of conversations to skip
 */
public record ListConversationsQuery(UserId userId, Set<ConversationStatus> statusFilter, int limit, int offset) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    public ListConversationsQuery {
        if (userId == null) {
            throw new ValidationException("userId", "userId must not be null");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit", "limit must be between 1 and %d, was %d".formatted(MAX_LIMIT, limit));
        }
        if (offset < 0) {
            throw new ValidationException("offset", "offset must be >= 0, was " + offset);
        }
        statusFilter = statusFilter == null || statusFilter.isEmpty()
                ? EnumSet.of(ConversationStatus.ACTIVE, ConversationStatus.ARCHIVED)
                : EnumSet.copyOf(statusFilter);
    }

    /** First page of ACTIVE and ARCHIVED conversations. */
    public static ListConversationsQuery firstPage(UserId userId) {
        return new ListConversationsQuery(userId, Set.of(), DEFAULT_LIMIT, 0);
    }
}
