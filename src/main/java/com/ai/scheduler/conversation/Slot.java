package com.ai.scheduler.conversation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Bookable interval offered to the user, with the labels used when it is read back.
 */
@Value
@Builder
public class Slot {

    Instant start;

    Instant end;

    /** e.g. "Thursday, January 16, 2025" */
    String dateLabel;

    /** e.g. "10:00 AM" */
    String timeLabel;

    /** e.g. "1 hour", "30 minutes" */
    String durationLabel;
}
