package com.ai.scheduler.calendar;

import com.ai.scheduler.conversation.BusyInterval;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Access to the user's calendar. Implementations may block on I/O and
 * signal failure with {@link CalendarUnavailableException}; callers go through
 * {@link CalendarGateway}, never to the provider directly.
 */
public interface CalendarProvider {

    List<BusyInterval> listBusyIntervals(LocalDate day);

    List<BusyInterval> listBusyIntervals(Instant windowStart, Instant windowEnd);

    /**
     * Creates an event; once it returns, the event's range is reported as busy.
     */
    CalendarEvent createEvent(Instant start, Instant end, String summary, String description);

    /** Events that have not yet ended at {@code from}, earliest first. */
    List<CalendarEvent> listUpcomingEvents(Instant from, int maxResults);
}
