package com.polyglot.domain.conversation;

import com.polyglot.domain.exception.ValidationException;

/**
 * How the AI tutor behaves inside one conversation.
 *
 * <p>Attached to a conversation when it starts and never mutated. The {@code with*} methods return
 * new instances.
 *
 * @param creativity variability of replies, from {@value #MIN_CREATIVITY} (deterministic) to
 *     {@value #MAX_CREATIVITY} (most expressive)
 * @param style pedagogical approach
 */
public record TutorProfile(double creativity, GenerationStyle style) {

    public static final double MIN_CREATIVITY = 0.0;
    public static final double MAX_CREATIVITY = 1.0;
    public static final double DEFAULT_CREATIVITY = 0.5;

    public TutorProfile {
        if (Double.isNaN(creativity) || creativity < MIN_CREATIVITY || creativity > MAX_CREATIVITY) {
            throw new ValidationException(
                    "tutorProfile.creativity",
                    "%s is outside [%s, %s]".formatted(creativity, MIN_CREATIVITY, MAX_CREATIVITY));
        }
        if (style == null) {
            throw new ValidationException("tutorProfile.style", "style must not be null");
        }
    }

    /** Balanced creativity, conversational style. */
    public static TutorProfile defaults() {
        return new TutorProfile(DEFAULT_CREATIVITY, GenerationStyle.CONVERSATIONAL);
    }

    public TutorProfile withCreativity(double creativity) {
        return new TutorProfile(creativity, style);
    }

    public TutorProfile withStyle(GenerationStyle style) {
        return new TutorProfile(creativity, style);
    }
}
