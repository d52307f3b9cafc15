package com.polyglot.application;

/**
 * A use case that changes state.
 *
 * <p>Returns only identifiers or {@code null} ({@link Void}) as acknowledgement, never a domain
 * entity. Domain exceptions propagate unmodified.
 *
 * @param <C> command type
 * @param <R> result type
 */
@FunctionalInterface
public interface CommandHandler<C, R> {

    R handle(C command);
}
