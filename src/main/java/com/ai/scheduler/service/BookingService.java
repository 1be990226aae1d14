package com.ai.scheduler.service;

import com.ai.scheduler.calendar.BookingResult;
import com.ai.scheduler.calendar.CalendarGateway;
import com.ai.scheduler.calendar.EventListResult;
import com.ai.scheduler.dto.BookingResponse;
import com.ai.scheduler.dto.EventsResponse;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Writes appointments to the calendar and reads back what is coming up.
 * A calendar that cannot be reached yields an unsuccessful response, never an exception.
 */
@Service
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    static final String DEFAULT_SUMMARY = "AI Booked Appointment";
    static final int MAX_EVENTS = 100;

    private final CalendarGateway calendarGateway;

    public BookingService(CalendarGateway calendarGateway) {
        this.calendarGateway = calendarGateway;
    }

    public BookingResponse book(Instant start, Instant end, String summary, String description) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("startTime and endTime are required");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("endTime must be after startTime");
        }
        BookingResult result = calendarGateway.book(start, end,
                StringUtils.defaultIfBlank(summary, DEFAULT_SUMMARY), description != null ? description : "");
        if (!result.success()) {
            log.warn("Booking {}..{} failed: {}", start, end, result.error());
            return BookingResponse.builder()
                    .success(false)
                    .message("Failed to book appointment: " + result.error())
                    .build();
        }
        log.info("Booked {} ({}..{})", result.event().getId(), start, end);
        return BookingResponse.builder()
                .success(true)
                .event(result.event())
                .message("Appointment booked successfully")
                .build();
    }

    /**
     * @param maxResults between 1 and {@value #MAX_EVENTS}
     */
    public EventsResponse upcomingEvents(Instant now, int maxResults) {
        if (maxResults <= 0 || maxResults > MAX_EVENTS) {
            throw new IllegalArgumentException("maxResults must be between 1 and " + MAX_EVENTS);
        }
        EventListResult result = calendarGateway.upcomingEvents(now, maxResults);
        if (!result.success()) {
            return new EventsResponse(result.events(), 0, "Calendar not connected");
        }
        return new EventsResponse(result.events(), result.events().size(), null);
    }
}
