package com.ai.scheduler.controller;

import com.ai.scheduler.conversation.TurnResult;
import com.ai.scheduler.dto.AvailabilityRequest;
import com.ai.scheduler.dto.AvailabilityResponse;
import com.ai.scheduler.dto.ChatRequest;
import com.ai.scheduler.dto.ChatResponse;
import com.ai.scheduler.service.AvailabilityService;
import com.ai.scheduler.service.ConversationRouter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private static final String DEFAULT_SESSION = "default";

    private final ConversationRouter router;
    private final AvailabilityService availabilityService;
    private final Clock clock;

    public ChatController(ConversationRouter router, AvailabilityService availabilityService, Clock clock) {
        this.router = router;
        this.availabilityService = availabilityService;
        this.clock = clock;
    }

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request) {
        if (request == null || StringUtils.isBlank(request.getMessage())) {
            throw new IllegalArgumentException("message is required");
        }
        String sessionId = StringUtils.defaultIfBlank(request.getSessionId(), DEFAULT_SESSION);
        TurnResult result = router.advanceConversation(sessionId, request.getMessage(), clock.instant());
        return ResponseEntity.ok(ChatResponse.from(sessionId, result));
    }

    @PostMapping("/availability")
    public ResponseEntity<AvailabilityResponse> availability(@RequestBody AvailabilityRequest request) {
        log.debug("Availability request {}", request);
        return ResponseEntity.ok(availabilityService.findFreeSlots(
                request.getStartDate(), request.getEndDate(), request.getDurationMinutes()));
    }
}
