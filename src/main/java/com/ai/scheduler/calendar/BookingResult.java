package com.ai.scheduler.calendar;

/**
 * Outcome of creating an event: the stored event, or the reason the provider refused or could not answer.
 */
public record BookingResult(boolean success, CalendarEvent event, String error) {

    public static BookingResult booked(CalendarEvent event) {
        return new BookingResult(true, event, null);
    }

    public static BookingResult providerError(String error) {
        return new BookingResult(false, null, error);
    }
}
