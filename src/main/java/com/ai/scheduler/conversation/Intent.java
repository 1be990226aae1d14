package com.ai.scheduler.conversation;

/**
 * Classified purpose of a single user utterance.
 */
public enum Intent {
    BOOK_APPOINTMENT,
    CHECK_AVAILABILITY,
    CONFIRM_BOOKING,
    REQUEST_ALTERNATIVES,
    MODIFY_BOOKING,
    GENERAL_INQUIRY
}
