package com.ai.scheduler.service;

import com.ai.scheduler.calendar.BusyLookupResult;
import com.ai.scheduler.calendar.CalendarGateway;
import com.ai.scheduler.config.SchedulerProperties;
import com.ai.scheduler.dto.AvailabilityResponse;
import com.ai.scheduler.conversation.Slot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Free-slot search over an explicit window, outside any conversation.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    static final int OFFLINE_SLOT_LIMIT = 10;

    private final CalendarGateway calendarGateway;
    private final AvailabilityEngine availabilityEngine;
    private final Duration maxWindow;

    public AvailabilityService(CalendarGateway calendarGateway, AvailabilityEngine availabilityEngine,
                               SchedulerProperties properties) {
        this.calendarGateway = calendarGateway;
        this.availabilityEngine = availabilityEngine;
        this.maxWindow = Duration.ofDays(Math.max(properties.getMaxWindowDays(), 1));
    }

    /**
     * When the calendar cannot be read, every working-hour slot in the window is offered,
     * capped at {@value #OFFLINE_SLOT_LIMIT}; the total still reports the uncapped count.
     */
    public AvailabilityResponse findFreeSlots(Instant start, Instant end, int durationMinutes) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        if (Duration.between(start, end).compareTo(maxWindow) > 0) {
            throw new IllegalArgumentException("Window must not exceed " + maxWindow.toDays() + " days");
        }
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("durationMinutes must be positive");
        }
        BusyLookupResult busy = calendarGateway.busyForWindow(start, end);
        if (busy.success()) {
            List<Slot> slots = availabilityEngine.freeSlots(busy.intervals(), start, end, durationMinutes);
            return new AvailabilityResponse(slots, slots.size());
        }
        log.warn("Calendar unavailable ({}); answering availability without busy data", busy.error());
        List<Slot> all = availabilityEngine.freeSlots(List.of(), start, end, durationMinutes);
        List<Slot> shown = all.size() > OFFLINE_SLOT_LIMIT ? all.subList(0, OFFLINE_SLOT_LIMIT) : all;
        return new AvailabilityResponse(List.copyOf(shown), all.size());
    }

    public boolean isCalendarReachable(Instant now) {
        return calendarGateway.busyForDay(now.atZone(availabilityEngine.getZone()).toLocalDate()).success();
    }
}
