package com.ai.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequest {

    private Instant startTime;

    private Instant endTime;

    private String summary = "AI Booked Appointment";

    private String description = "";
}
