/**
 * Capability contracts the tutoring core depends on. Adapters implement them; nothing in the core
 * implements them except the fakes in {@code com.polyglot.domain.testing}.
 */
package com.polyglot.domain.port;
