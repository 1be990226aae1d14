package com.ai.scheduler.config;

import com.ai.scheduler.conversation.WorkingHours;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code scheduler} prefix.
 */
@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /** Zone used to turn instants into calendar days and wall-clock hours. */
    private String zone = "UTC";

    /** Days scanned when the user has not named a date. */
    private int lookaheadDays = 3;

    /** Slots kept from a lookup without a preferred date. */
    private int maxSuggestions = 5;

    /** Longest window accepted by the availability search. */
    private int maxWindowDays = 31;

    private Hours workingHours = new Hours();

    private Calendar calendar = new Calendar();

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public WorkingHours workingHours() {
        return new WorkingHours(workingHours.getStartHour(), workingHours.getEndHour());
    }

    @Data
    public static class Hours {
        private int startHour = 9;
        private int endHour = 17;
    }

    @Data
    public static class Calendar {

        /** Upper bound on a single provider call. */
        private long timeoutMs = 3000;

        private int lookupThreads = 4;

        /** Busy intervals loaded into the in-memory provider at startup. */
        private List<BusySeed> busy = new ArrayList<>();
    }

    @Data
    public static class BusySeed {
        /** ISO-8601 instant, e.g. 2025-01-16T10:00:00Z */
        private String start;
        private String end;
    }
}
