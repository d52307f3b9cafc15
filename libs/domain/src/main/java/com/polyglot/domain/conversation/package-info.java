/**
 * The conversation aggregate: {@link com.polyglot.domain.conversation.Conversation} owns its
 * {@link com.polyglot.domain.conversation.ChatMessage} sequence and its lifecycle state machine.
 */
package com.polyglot.domain.conversation;
