package com.ai.scheduler.conversation;

import lombok.Value;

import java.time.Instant;

/**
 * Occupied range reported by the calendar. Start inclusive, end exclusive.
 */
@Value
public class BusyInterval {

    Instant start;

    Instant end;

    public BusyInterval(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Busy interval needs both start and end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Busy interval ends before it starts: " + start + " > " + end);
        }
        this.start = start;
        this.end = end;
    }

    public boolean overlaps(Instant from, Instant to) {
        return from.isBefore(end) && to.isAfter(start);
    }
}
