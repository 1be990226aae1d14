package com.ai.scheduler.dto;

import com.ai.scheduler.calendar.CalendarEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class EventsResponse {

    private final List<CalendarEvent> events;

    private final int count;

    /** Set only when the calendar could not be read. */
    private final String message;
}
