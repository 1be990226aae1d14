package com.ai.scheduler.calendar;

import com.ai.scheduler.conversation.BusyInterval;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Calendar held in memory. Used as the default provider and seeded from
 * {@code scheduler.calendar.busy}. Booked events count as busy time.
 */
public class InMemoryCalendarProvider implements CalendarProvider {

    static final String SEED_SUMMARY = "Busy";

    private final ZoneId zone;
    private final List<CalendarEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public InMemoryCalendarProvider(ZoneId zone, Collection<BusyInterval> seed) {
        this.zone = zone;
        if (seed != null) {
            seed.forEach(this::add);
        }
    }

    public void add(BusyInterval interval) {
        events.add(newEvent(interval.getStart(), interval.getEnd(), SEED_SUMMARY, ""));
    }

    public int size() {
        return events.size();
    }

    @Override
    public List<BusyInterval> listBusyIntervals(LocalDate day) {
        Instant from = day.atStartOfDay(zone).toInstant();
        Instant to = day.plusDays(1).atStartOfDay(zone).toInstant();
        return listBusyIntervals(from, to);
    }

    @Override
    public List<BusyInterval> listBusyIntervals(Instant windowStart, Instant windowEnd) {
        if (windowEnd.isBefore(windowStart)) {
            throw new IllegalArgumentException("Window ends before it starts");
        }
        return events.stream()
                .map(CalendarEvent::toBusyInterval)
                .filter(b -> b.overlaps(windowStart, windowEnd) || b.getStart().equals(windowStart))
                .sorted(Comparator.comparing(BusyInterval::getStart))
                .collect(Collectors.toList());
    }

    @Override
    public CalendarEvent createEvent(Instant start, Instant end, String summary, String description) {
        if (start == null || end == null || !end.isAfter(start)) {
            throw new IllegalArgumentException("Event must end after it starts");
        }
        CalendarEvent event = newEvent(start, end, summary, description);
        events.add(event);
        return event;
    }

    @Override
    public List<CalendarEvent> listUpcomingEvents(Instant from, int maxResults) {
        return events.stream()
                .filter(e -> e.getEnd().isAfter(from))
                .sorted(Comparator.comparing(CalendarEvent::getStart))
                .limit(Math.max(maxResults, 0))
                .collect(Collectors.toList());
    }

    private CalendarEvent newEvent(Instant start, Instant end, String summary, String description) {
        return CalendarEvent.builder()
                .id("evt-" + nextId.getAndIncrement())
                .summary(summary)
                .description(description != null ? description : "")
                .start(start)
                .end(end)
                .build();
    }
}
