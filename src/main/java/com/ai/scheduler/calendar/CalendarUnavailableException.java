package com.ai.scheduler.calendar;

/**
 * Raised by a {@link CalendarProvider} when the calendar cannot be read (network, auth, quota).
 */
public class CalendarUnavailableException extends RuntimeException {

    public CalendarUnavailableException(String message) {
        super(message);
    }

    public CalendarUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
