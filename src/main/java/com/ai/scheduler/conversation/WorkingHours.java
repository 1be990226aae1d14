package com.ai.scheduler.conversation;

/**
 * Daily window, in whole hours of the configured zone, inside which slots are generated.
 */
public record WorkingHours(int startHour, int endHour) {

    public static final WorkingHours DEFAULT = new WorkingHours(9, 17);

    public WorkingHours {
        if (startHour < 0 || endHour > 24 || startHour >= endHour) {
            throw new IllegalArgumentException("Invalid working hours: " + startHour + "-" + endHour);
        }
    }

    public int minutes() {
        return (endHour - startHour) * 60;
    }
}
