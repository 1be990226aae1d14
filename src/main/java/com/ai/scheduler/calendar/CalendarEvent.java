package com.ai.scheduler.calendar;

import com.ai.scheduler.conversation.BusyInterval;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CalendarEvent {

    String id;

    String summary;

    String description;

    Instant start;

    Instant end;

    public BusyInterval toBusyInterval() {
        return new BusyInterval(start, end);
    }
}
