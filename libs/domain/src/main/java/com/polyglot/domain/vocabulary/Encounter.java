package com.polyglot.domain.vocabulary;

import java.time.Instant;
import java.util.Objects;

/** A lexeme showing up in a chat message. */
public record Encounter(MessageReference message, Instant encounteredAt) {

    public Encounter {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(encounteredAt, "encounteredAt must not be null");
    }
}
