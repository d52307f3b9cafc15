package com.polyglot.domain.exception;

/**
 * Closed set of failure kinds the tutoring core can raise.
 *
 * <p>Adapters translate a kind to their transport (HTTP status, CLI exit code). The core never
 * raises anything outside this list.
 */
public enum ErrorKind {

    /** A value object or entity was constructed or mutated with invalid data. */
    VALIDATION,

    /** A conversation lifecycle transition the state machine does not allow. */
    INVALID_STATE_TRANSITION,

    /** A message was appended to a conversation that is not ACTIVE. */
    CONVERSATION_NOT_ACTIVE,

    /** A review could not be recorded against a vocabulary item. */
    INVALID_REVIEW_OUTCOME,

    /** An aggregate is absent from its repository. */
    NOT_FOUND,

    /** A repository detected a concurrent write to the same aggregate. */
    CONFLICT,

    /** The AI tutor failed to produce a usable answer. */
    PROVIDER,

    /** A port call did not complete in time. */
    PORT_TIMEOUT,

    /** A port's backing system is unreachable. */
    PORT_UNAVAILABLE
}
