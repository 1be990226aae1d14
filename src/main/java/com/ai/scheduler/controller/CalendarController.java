package com.ai.scheduler.controller;

import com.ai.scheduler.dto.BookingRequest;
import com.ai.scheduler.dto.BookingResponse;
import com.ai.scheduler.dto.EventsResponse;
import com.ai.scheduler.service.BookingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
public class CalendarController {

    private final BookingService bookingService;
    private final Clock clock;

    public CalendarController(BookingService bookingService, Clock clock) {
        this.bookingService = bookingService;
        this.clock = clock;
    }

    @PostMapping("/book")
    public ResponseEntity<BookingResponse> book(@RequestBody BookingRequest request) {
        return ResponseEntity.ok(bookingService.book(
                request.getStartTime(), request.getEndTime(), request.getSummary(), request.getDescription()));
    }

    @GetMapping("/events")
    public ResponseEntity<EventsResponse> events(@RequestParam(name = "max_results", defaultValue = "10") int maxResults) {
        return ResponseEntity.ok(bookingService.upcomingEvents(clock.instant(), maxResults));
    }
}
