package com.polyglot.application.support;

import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.user.UserId;
import org.slf4j.MDC;

import java.util.function.Supplier;

/**
 * Puts the running use case and the ids it works on into the SLF4J {@link MDC}.
 * <p>
 * Every log statement emitted while a use case runs, including those of port adapters on the same
 * thread, then carries {@value #MDC_USE_CASE}, {@value #MDC_USER_ID} and
 * {@value #MDC_CONVERSATION_ID}. Previous values are restored afterwards, so a use case invoked
 * from inside another adapter's context leaves that context intact.
 */
public final class UseCaseLogContext {

    public static final String MDC_USE_CASE = "useCase";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_CONVERSATION_ID = "conversationId";

    private UseCaseLogContext() {
        // utility class
    }

    /**
     * Runs {@code work} with the MDC populated, then restores the previous values.
     *
     * @param useCase use case name, e.g. "SendMessage"
     * @param userId learner, may be null when not known yet
     * @param conversationId conversation, may be null
     */
    public static <T> T call(String useCase, UserId userId, ConversationId conversationId, Supplier<T> work) {
        String previousUseCase = MDC.get(MDC_USE_CASE);
        String previousUserId = MDC.get(MDC_USER_ID);
        String previousConversationId = MDC.get(MDC_CONVERSATION_ID);
        try {
            setMdc(MDC_USE_CASE, useCase);
            setMdc(MDC_USER_ID, userId == null ? null : userId.toString());
            setMdc(MDC_CONVERSATION_ID, conversationId == null ? null : conversationId.toString());
            return work.get();
        } finally {
            setMdc(MDC_USE_CASE, previousUseCase);
            setMdc(MDC_USER_ID, previousUserId);
            setMdc(MDC_CONVERSATION_ID, previousConversationId);
        }
    }

    /** {@link #call} for work without a result. */
    public static void run(String useCase, UserId userId, ConversationId conversationId, Runnable work) {
        call(useCase, userId, conversationId, () -> {
            work.run();
            return null;
        });
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
