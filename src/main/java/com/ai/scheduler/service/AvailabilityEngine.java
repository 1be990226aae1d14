package com.ai.scheduler.service;

import com.ai.scheduler.config.SchedulerProperties;
import com.ai.scheduler.conversation.BusyInterval;
import com.ai.scheduler.conversation.Slot;
import com.ai.scheduler.conversation.WorkingHours;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns busy intervals into bookable slots. Stateless; safe to share between sessions.
 * <p>
 * Two conflict rules are in use and they are not the same:
 * <ul>
 *   <li>{@link #slotsForDay} rejects an hourly candidate only when a busy interval
 *       <em>starts</em> inside it. An interval that began earlier and runs into the
 *       candidate does not block it.</li>
 *   <li>{@link #freeSlots} uses true overlap and jumps the cursor to the end of the
 *       blocking interval.</li>
 * </ul>
 */
@Service
public class AvailabilityEngine {

    static final int MOCK_SLOT_COUNT = 5;
    private static final int MOCK_FIRST_HOUR = 10;

    private static final DateTimeFormatter DATE_LABEL = DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_LABEL = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    private final ZoneId zone;
    private final WorkingHours workingHours;

    public AvailabilityEngine(SchedulerProperties properties) {
        this.zone = properties.zoneId();
        this.workingHours = properties.workingHours();
    }

    /**
     * One-hour candidates across the working day of {@code day}, in order.
     */
    public List<Slot> slotsForDay(List<BusyInterval> busy, LocalDate day) {
        List<Slot> slots = new ArrayList<>();
        ZonedDateTime cursor = day.atTime(workingHours.startHour(), 0).atZone(zone);
        ZonedDateTime dayEnd = endOfWorkingDay(day);
        while (cursor.isBefore(dayEnd)) {
            ZonedDateTime slotEnd = cursor.plusHours(1);
            if (!startsInside(busy, cursor.toInstant(), slotEnd.toInstant())) {
                slots.add(toSlot(cursor, slotEnd, "1 hour"));
            }
            cursor = slotEnd;
        }
        return slots;
    }

    /**
     * Slots of {@code durationMinutes} inside working hours on every day from
     * {@code windowStart}'s date to {@code windowEnd}'s date, both inclusive.
     * A slot always fits entirely inside the working window of its day.
     */
    public List<Slot> freeSlots(List<BusyInterval> busy, Instant windowStart, Instant windowEnd,
                                int durationMinutes, WorkingHours hours) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + durationMinutes);
        }
        List<BusyInterval> sorted = new ArrayList<>(busy);
        sorted.sort(Comparator.comparing(BusyInterval::getStart));

        List<Slot> slots = new ArrayList<>();
        String durationLabel = durationMinutes + " minutes";
        LocalDate lastDay = windowEnd.atZone(zone).toLocalDate();
        for (LocalDate day = windowStart.atZone(zone).toLocalDate(); !day.isAfter(lastDay); day = day.plusDays(1)) {
            ZonedDateTime dayEnd = day.atStartOfDay(zone).plusHours(hours.endHour());
            ZonedDateTime cursor = day.atTime(hours.startHour(), 0).atZone(zone);
            while (!cursor.plusMinutes(durationMinutes).isAfter(dayEnd)) {
                ZonedDateTime slotEnd = cursor.plusMinutes(durationMinutes);
                Optional<BusyInterval> conflict = firstOverlap(sorted, cursor.toInstant(), slotEnd.toInstant());
                if (conflict.isPresent()) {
                    cursor = conflict.get().getEnd().atZone(zone);
                } else {
                    slots.add(toSlot(cursor, slotEnd, durationLabel));
                    cursor = slotEnd;
                }
                if (!cursor.isBefore(dayEnd)) {
                    break;
                }
            }
        }
        return slots;
    }

    public List<Slot> freeSlots(List<BusyInterval> busy, Instant windowStart, Instant windowEnd, int durationMinutes) {
        return freeSlots(busy, windowStart, windowEnd, durationMinutes, workingHours);
    }

    /**
     * Stand-in availability for when the calendar cannot be read: five one-hour slots
     * at 10:00 on consecutive days starting {@code today}, shifted by 0, 1, 2, 0, 1 hours.
     */
    public List<Slot> mockSlots(LocalDate today) {
        List<Slot> slots = new ArrayList<>(MOCK_SLOT_COUNT);
        ZonedDateTime base = today.atTime(MOCK_FIRST_HOUR, 0).atZone(zone);
        for (int i = 0; i < MOCK_SLOT_COUNT; i++) {
            ZonedDateTime start = base.plusDays(i).plusHours(i % 3);
            slots.add(toSlot(start, start.plusHours(1), "1 hour"));
        }
        return slots;
    }

    public WorkingHours getWorkingHours() {
        return workingHours;
    }

    public ZoneId getZone() {
        return zone;
    }

    private ZonedDateTime endOfWorkingDay(LocalDate day) {
        return day.atStartOfDay(zone).plusHours(workingHours.endHour());
    }

    private static boolean startsInside(List<BusyInterval> busy, Instant from, Instant to) {
        for (BusyInterval b : busy) {
            Instant s = b.getStart();
            if (!s.isBefore(from) && s.isBefore(to)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<BusyInterval> firstOverlap(List<BusyInterval> sorted, Instant from, Instant to) {
        for (BusyInterval b : sorted) {
            if (b.overlaps(from, to)) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }

    private static Slot toSlot(ZonedDateTime start, ZonedDateTime end, String durationLabel) {
        LocalDateTime local = start.toLocalDateTime();
        return Slot.builder()
                .start(start.toInstant())
                .end(end.toInstant())
                .dateLabel(local.format(DATE_LABEL))
                .timeLabel(local.format(TIME_LABEL))
                .durationLabel(durationLabel)
                .build();
    }
}
