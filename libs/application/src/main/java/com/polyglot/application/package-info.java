/**
 * Use cases of the tutoring core, grouped by aggregate. Every use case is a {@link
 * com.polyglot.application.CommandHandler} or a {@link com.polyglot.application.QueryHandler} and
 * depends only on domain ports, a {@link java.time.Clock} and configuration.
 */
package com.polyglot.application;
