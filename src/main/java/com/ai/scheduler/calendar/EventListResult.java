package com.ai.scheduler.calendar;

import java.util.List;

public record EventListResult(boolean success, List<CalendarEvent> events, String error) {

    public static EventListResult success(List<CalendarEvent> events) {
        return new EventListResult(true, events != null ? List.copyOf(events) : List.of(), null);
    }

    public static EventListResult providerError(String error) {
        return new EventListResult(false, List.of(), error);
    }
}
