package com.ai.scheduler.controller;

import com.ai.scheduler.calendar.CalendarGateway;
import com.ai.scheduler.calendar.InMemoryCalendarProvider;
import com.ai.scheduler.component.ConversationSessionStore;
import com.ai.scheduler.component.ResponsePhrases;
import com.ai.scheduler.config.SchedulerProperties;
import com.ai.scheduler.conversation.BusyInterval;
import com.ai.scheduler.service.AvailabilityEngine;
import com.ai.scheduler.service.AvailabilityService;
import com.ai.scheduler.service.BookingService;
import com.ai.scheduler.service.ConversationRouter;
import com.ai.scheduler.service.DateTimeExtractor;
import com.ai.scheduler.service.IntentClassifier;
import com.ai.scheduler.service.ResponseComposer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ChatControllerTest {

    private final ResponsePhrases phrases = new ResponsePhrases();

    private ExecutorService executor;
    private ConversationSessionStore sessionStore;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        SchedulerProperties properties = new SchedulerProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-01-15T08:00:00Z"), ZoneOffset.UTC);
        InMemoryCalendarProvider provider = new InMemoryCalendarProvider(ZoneOffset.UTC, List.of(
                new BusyInterval(Instant.parse("2025-01-16T10:00:00Z"), Instant.parse("2025-01-16T11:00:00Z"))));
        executor = Executors.newSingleThreadExecutor();
        sessionStore = new ConversationSessionStore();

        CalendarGateway gateway = new CalendarGateway(provider, executor, properties);
        AvailabilityEngine engine = new AvailabilityEngine(properties);
        AvailabilityService availabilityService = new AvailabilityService(gateway, engine, properties);
        ConversationRouter router = new ConversationRouter(sessionStore, new IntentClassifier(),
                new DateTimeExtractor(), engine, gateway, new ResponseComposer(phrases), properties);

        mockMvc = MockMvcBuilders
                .standaloneSetup(new ChatController(router, availabilityService, clock),
                        new SessionController(sessionStore, availabilityService, clock),
                        new CalendarController(new BookingService(gateway), clock))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldAnswerChatTurn() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"I want to schedule a meeting tomorrow afternoon\",\"sessionId\":\"web-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("book_appointment"))
                .andExpect(jsonPath("$.conversationStage").value("presenting_options"))
                .andExpect(jsonPath("$.availableSlots", hasSize(7)))
                .andExpect(jsonPath("$.availableSlots[1].timeLabel").value("11:00 AM"))
                .andExpect(jsonPath("$.bookingConfirmed").value(false))
                .andExpect(jsonPath("$.sessionId").value("web-1"))
                .andExpect(jsonPath("$.response", startsWith(phrases.optionsIntro())));

        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"yes, book it\",\"sessionId\":\"web-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("confirm_booking"))
                .andExpect(jsonPath("$.conversationStage").value("confirmed"))
                .andExpect(jsonPath("$.bookingConfirmed").value(true))
                .andExpect(jsonPath("$.response").value(phrases.bookingConfirmed()));
    }

    @Test
    public void shouldUseDefaultSessionWhenNoneGiven() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("default"))
                .andExpect(jsonPath("$.response").value(phrases.greeting()));
    }

    @Test
    public void shouldRejectBlankMessage() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("message is required"));
    }

    @Test
    public void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void shouldListFreeSlotsForWindow() throws Exception {
        mockMvc.perform(post("/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2025-01-16T00:00:00Z\",\"endDate\":\"2025-01-16T23:59:59Z\",\"durationMinutes\":60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSlots").value(7))
                .andExpect(jsonPath("$.availableSlots", hasSize(7)))
                .andExpect(jsonPath("$.availableSlots[1].timeLabel").value("11:00 AM"));
    }

    @Test
    public void shouldRejectInvertedAvailabilityWindow() throws Exception {
        mockMvc.perform(post("/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2025-01-17T00:00:00Z\",\"endDate\":\"2025-01-16T00:00:00Z\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void shouldRejectOversizedAvailabilityWindow() throws Exception {
        mockMvc.perform(post("/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2025-01-16T00:00:00Z\",\"endDate\":\"2325-01-16T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Window must not exceed 31 days"));
    }

    @Test
    public void shouldBookSlotAndHideItFromLaterSearches() throws Exception {
        mockMvc.perform(post("/book")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startTime\":\"2025-01-16T14:00:00Z\",\"endTime\":\"2025-01-16T15:00:00Z\",\"summary\":\"Sync\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.event.summary").value("Sync"))
                .andExpect(jsonPath("$.message").value("Appointment booked successfully"));

        mockMvc.perform(post("/availability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2025-01-16T00:00:00Z\",\"endDate\":\"2025-01-16T23:59:59Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSlots").value(6));

        mockMvc.perform(get("/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.events[0].summary").value("Busy"))
                .andExpect(jsonPath("$.events[1].summary").value("Sync"));
    }

    @Test
    public void shouldRejectBookingThatEndsBeforeItStarts() throws Exception {
        mockMvc.perform(post("/book")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startTime\":\"2025-01-16T15:00:00Z\",\"endTime\":\"2025-01-16T14:00:00Z\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/events").param("max_results", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void shouldClearSessions() throws Exception {
        mockMvc.perform(delete("/sessions/nobody"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Session not found"));

        mockMvc.perform(post("/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hi\",\"sessionId\":\"web-2\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/sessions/web-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Session web-2 cleared"));

        mockMvc.perform(delete("/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Cleared 0 sessions"));
    }

    @Test
    public void shouldReportHealth() throws Exception {
        sessionStore.withSession("web-3", state -> null);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.calendar").value("OK"))
                .andExpect(jsonPath("$.sessions").value(1))
                .andExpect(jsonPath("$.timestamp").value("2025-01-15T08:00:00Z"));
    }
}
