/**
 * Vocabulary items and spaced-repetition scheduling.
 *
 * <p>{@link com.polyglot.domain.vocabulary.ReviewSchedulingPolicy} is a pure function of the review
 * history. Nothing in this package reads a clock; callers pass the instant they care about.
 */
package com.polyglot.domain.vocabulary;
