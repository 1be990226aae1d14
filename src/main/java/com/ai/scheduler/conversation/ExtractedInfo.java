package com.ai.scheduler.conversation;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Temporal hints gathered from the user so far. Date and time-of-day are optional;
 * the duration token always has a value.
 */
@Value
@Builder(toBuilder = true)
public class ExtractedInfo {

    public static final String DEFAULT_DURATION = "1 hour";

    static final int DEFAULT_MINUTES = 60;

    /** Longest duration taken at face value: one day. */
    static final int MAX_MINUTES = 24 * 60;

    private static final Pattern DURATION_TOKEN = Pattern.compile("(\\d+)\\s*(hour|minute)");

    LocalDate preferredDate;

    /** Matched text kept verbatim, e.g. "3:30 pm" or "afternoon". */
    String timePreference;

    @Builder.Default
    String duration = DEFAULT_DURATION;

    public static ExtractedInfo empty() {
        return ExtractedInfo.builder().build();
    }

    public boolean hasPreferredDate() {
        return preferredDate != null;
    }

    /**
     * Duration token in minutes; 60 when the token cannot be read or lies
     * outside (0, one day].
     */
    public int durationMinutes() {
        if (duration == null) {
            return DEFAULT_MINUTES;
        }
        Matcher m = DURATION_TOKEN.matcher(duration);
        if (!m.find()) {
            return DEFAULT_MINUTES;
        }
        long amount;
        try {
            amount = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return DEFAULT_MINUTES;
        }
        if (amount <= 0 || amount > MAX_MINUTES) {
            return DEFAULT_MINUTES;
        }
        long minutes = "hour".equals(m.group(2)) ? amount * 60 : amount;
        return minutes <= MAX_MINUTES ? (int) minutes : DEFAULT_MINUTES;
    }
}
