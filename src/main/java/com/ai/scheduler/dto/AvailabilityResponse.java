package com.ai.scheduler.dto;

import com.ai.scheduler.conversation.Slot;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class AvailabilityResponse {

    private final List<Slot> availableSlots;

    private final int totalSlots;
}
