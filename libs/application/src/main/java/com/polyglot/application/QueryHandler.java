package com.polyglot.application;

/**
 * A use case that reads state and returns a read model.
 *
 * <p>Implementations never call a repository write method.
 *
 * @param <Q> query type
 * @param <R> read model type
 */
@FunctionalInterface
public interface QueryHandler<Q, R> {

    R handle(Q query);
}
