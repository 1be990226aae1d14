package com.ai.scheduler.controller;

import com.ai.scheduler.component.ConversationSessionStore;
import com.ai.scheduler.service.AvailabilityService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class SessionController {

    private final ConversationSessionStore sessionStore;
    private final AvailabilityService availabilityService;
    private final Clock clock;

    public SessionController(ConversationSessionStore sessionStore, AvailabilityService availabilityService, Clock clock) {
        this.sessionStore = sessionStore;
        this.availabilityService = availabilityService;
        this.clock = clock;
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Map<String, String>> clearSession(@PathVariable String sessionId) {
        if (!sessionStore.evict(sessionId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Session not found"));
        }
        return ResponseEntity.ok(Map.of("message", "Session " + sessionId + " cleared"));
    }

    @DeleteMapping("/sessions")
    public ResponseEntity<Map<String, String>> clearAllSessions() {
        int count = sessionStore.clear();
        return ResponseEntity.ok(Map.of("message", "Cleared " + count + " sessions"));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Instant now = clock.instant();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", now.toString());
        body.put("calendar", availabilityService.isCalendarReachable(now) ? "OK" : "Not connected");
        body.put("sessions", sessionStore.size());
        return ResponseEntity.ok(body);
    }
}
