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
public class AvailabilityRequest {

    private Instant startDate;

    private Instant endDate;

    private int durationMinutes = 60;
}
