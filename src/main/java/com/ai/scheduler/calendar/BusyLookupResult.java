package com.ai.scheduler.calendar;

import com.ai.scheduler.conversation.BusyInterval;

import java.util.List;

/**
 * Outcome of a calendar lookup: the busy intervals, or the reason the provider could not answer.
 */
public record BusyLookupResult(boolean success, List<BusyInterval> intervals, String error) {

    public static BusyLookupResult success(List<BusyInterval> intervals) {
        return new BusyLookupResult(true, intervals != null ? List.copyOf(intervals) : List.of(), null);
    }

    public static BusyLookupResult providerError(String error) {
        return new BusyLookupResult(false, List.of(), error);
    }
}
