package com.polyglot.application.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.polyglot.domain.conversation.ConversationId;
import com.polyglot.domain.user.UserId;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("UseCaseLogContext")
class UseCaseLogContextTest {

    @AfterEach
    void cleanup() {
        MDC.clear();
    }

    @Test
    @DisplayName("populates MDC keys while the work runs")
    void populates() {
        var userId = UserId.generate();
        var conversationId = ConversationId.generate();
        var seen = new AtomicReference<String>();

        String result = UseCaseLogContext.call("SendMessage", userId, conversationId, () -> {
            seen.set(MDC.get(UseCaseLogContext.MDC_USE_CASE) + "|" + MDC.get(UseCaseLogContext.MDC_USER_ID)
                    + "|" + MDC.get(UseCaseLogContext.MDC_CONVERSATION_ID));
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(seen.get()).isEqualTo("SendMessage|" + userId + "|" + conversationId);
        assertThat(MDC.get(UseCaseLogContext.MDC_USE_CASE)).isNull();
    }

    @Test
    @DisplayName("null ids leave their keys unset")
    void nullIds() {
        var seen = new AtomicReference<String>("unset");

        UseCaseLogContext.run("RegisterUser", null, null, () -> seen.set(MDC.get(UseCaseLogContext.MDC_CONVERSATION_ID)));

        assertThat(seen.get()).isNull();
    }

    @Test
    @DisplayName("restores the previous values, also when the work throws")
    void restores() {
        MDC.put(UseCaseLogContext.MDC_USE_CASE, "outer");
        MDC.put(UseCaseLogContext.MDC_USER_ID, "outer-user");

        assertThatThrownBy(() -> UseCaseLogContext.run("inner", UserId.generate(), ConversationId.generate(), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(MDC.get(UseCaseLogContext.MDC_USE_CASE)).isEqualTo("outer");
        assertThat(MDC.get(UseCaseLogContext.MDC_USER_ID)).isEqualTo("outer-user");
        assertThat(MDC.get(UseCaseLogContext.MDC_CONVERSATION_ID)).isNull();
    }
}
