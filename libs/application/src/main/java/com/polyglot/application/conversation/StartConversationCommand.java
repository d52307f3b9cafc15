package com.polyglot.application.conversation;

import com.polyglot.domain.conversation.TutorProfile;
import com.polyglot.domain.user.UserId;

/**
 * Starts a conversation in the learner's current target language.
 *
 * @param title optional, blank means the default title
 * @param tutorProfile optional, null means {@link TutorProfile#defaults()}
 */
public record StartConversationCommand(UserId userId, String title, TutorProfile tutorProfile) {

    public StartConversationCommand(UserId userId, TutorProfile tutorProfile) {
        this(userId, null, tutorProfile);
    }
}
