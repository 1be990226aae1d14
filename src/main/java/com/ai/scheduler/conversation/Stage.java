package com.ai.scheduler.conversation;

/**
 * Position of a session in the booking workflow.
 */
public enum Stage {
    INITIAL,
    GATHERING_INFO,
    PRESENTING_OPTIONS,
    PRESENTING_ALTERNATIVES,
    CONFIRMING,
    CONFIRMED
}
