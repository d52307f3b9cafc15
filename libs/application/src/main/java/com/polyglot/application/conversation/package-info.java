/**
 * Conversation use cases: lifecycle commands, sending messages through the AI tutor, and the
 * list and detail queries.
 */
package com.polyglot.application.conversation;
