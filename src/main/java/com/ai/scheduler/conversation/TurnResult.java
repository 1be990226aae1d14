package com.ai.scheduler.conversation;

/**
 * Outcome of one conversation turn: the text to show and a snapshot of the state it left behind.
 */
public record TurnResult(String responseText, ConversationState state) {
}
