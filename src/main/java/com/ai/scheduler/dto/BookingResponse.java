package com.ai.scheduler.dto;

import com.ai.scheduler.calendar.CalendarEvent;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class BookingResponse {

    private final boolean success;

    private final CalendarEvent event;

    private final String message;
}
