package com.ai.scheduler.service;

import com.ai.scheduler.calendar.BusyLookupResult;
import com.ai.scheduler.calendar.CalendarGateway;
import com.ai.scheduler.component.ConversationSessionStore;
import com.ai.scheduler.config.SchedulerProperties;
import com.ai.scheduler.conversation.ConversationState;
import com.ai.scheduler.conversation.ExtractedInfo;
import com.ai.scheduler.conversation.Intent;
import com.ai.scheduler.conversation.Slot;
import com.ai.scheduler.conversation.Stage;
import com.ai.scheduler.conversation.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Drives one conversation turn: classify, assign the stage, optionally extract
 * hints and look up availability, optionally confirm, then compose the reply.
 * Each turn runs once from top to bottom and always ends with a response.
 */
@Service
public class ConversationRouter {

    private static final Logger log = LoggerFactory.getLogger(ConversationRouter.class);

    private static final Set<Intent> LOOKUP_INTENTS = EnumSet.of(Intent.BOOK_APPOINTMENT, Intent.CHECK_AVAILABILITY);

    enum AfterIntent { CONFIRM, EXTRACT_THEN_LOOKUP, LOOKUP, RESPOND }

    enum AfterLookup { ALTERNATIVES, CONFIRM, RESPOND }

    private final ConversationSessionStore sessionStore;
    private final IntentClassifier intentClassifier;
    private final DateTimeExtractor extractor;
    private final AvailabilityEngine availabilityEngine;
    private final CalendarGateway calendarGateway;
    private final ResponseComposer responseComposer;
    private final ZoneId zone;
    private final int lookaheadDays;
    private final int maxSuggestions;

    public ConversationRouter(ConversationSessionStore sessionStore,
                              IntentClassifier intentClassifier,
                              DateTimeExtractor extractor,
                              AvailabilityEngine availabilityEngine,
                              CalendarGateway calendarGateway,
                              ResponseComposer responseComposer,
                              SchedulerProperties properties) {
        this.sessionStore = sessionStore;
        this.intentClassifier = intentClassifier;
        this.extractor = extractor;
        this.availabilityEngine = availabilityEngine;
        this.calendarGateway = calendarGateway;
        this.responseComposer = responseComposer;
        this.zone = properties.zoneId();
        this.lookaheadDays = Math.max(properties.getLookaheadDays(), 1);
        this.maxSuggestions = Math.max(properties.getMaxSuggestions(), 1);
    }

    /**
     * Advances the conversation for {@code sessionKey} by one user utterance.
     * Unknown keys start a fresh session.
     *
     * @param now reference instant for relative dates ("tomorrow", "friday")
     */
    public TurnResult advanceConversation(String sessionKey, String utterance, Instant now) {
        return sessionStore.withSession(sessionKey, state -> runTurn(sessionKey, state, utterance, now));
    }

    TurnResult runTurn(String sessionKey, ConversationState state, String utterance, Instant now) {
        log.info("[{}] User: {}", sessionKey, utterance);
        LocalDate today = now.atZone(zone).toLocalDate();

        Intent intent = intentClassifier.classify(utterance);
        state.setIntent(intent);
        assignStage(state, intent);

        AfterIntent route = routeAfterIntent(state, intent);
        log.debug("[{}] intent={} stage={} route={}", sessionKey, intent, state.getStage(), route);
        switch (route) {
            case CONFIRM:
                confirm(state);
                break;
            case EXTRACT_THEN_LOOKUP:
                state.setExtractedInfo(extractor.extract(utterance, state.getExtractedInfo(), today));
                state.setStage(Stage.GATHERING_INFO);
                lookupAndRoute(sessionKey, state, today);
                break;
            case LOOKUP:
                lookupAndRoute(sessionKey, state, today);
                break;
            case RESPOND:
            default:
                break;
        }

        String response = responseComposer.compose(state);
        state.completeTurn();
        log.info("[{}] Assistant ({} / {}, {} slots): {}", sessionKey, state.getIntent(), state.getStage(),
                state.getAvailableSlots().size(), response);
        return new TurnResult(response, state.copy());
    }

    /** Uses the slot list left by the previous turn. */
    static void assignStage(ConversationState state, Intent intent) {
        if (state.isFresh()) {
            state.setStage(Stage.INITIAL);
        } else if (intent == Intent.CONFIRM_BOOKING) {
            state.setStage(Stage.CONFIRMING);
        } else if (state.hasAvailableSlots()) {
            state.setStage(Stage.PRESENTING_OPTIONS);
        } else {
            state.setStage(Stage.GATHERING_INFO);
        }
    }

    static AfterIntent routeAfterIntent(ConversationState state, Intent intent) {
        if (intent == Intent.CONFIRM_BOOKING) {
            return AfterIntent.CONFIRM;
        }
        if (LOOKUP_INTENTS.contains(intent)) {
            return state.getExtractedInfo().hasPreferredDate() ? AfterIntent.LOOKUP : AfterIntent.EXTRACT_THEN_LOOKUP;
        }
        return AfterIntent.RESPOND;
    }

    static AfterLookup routeAfterLookup(ConversationState state) {
        if (!state.hasAvailableSlots() && state.getIntent() == Intent.REQUEST_ALTERNATIVES) {
            return AfterLookup.ALTERNATIVES;
        }
        if (state.hasAvailableSlots() && state.getIntent() == Intent.CONFIRM_BOOKING) {
            return AfterLookup.CONFIRM;
        }
        return AfterLookup.RESPOND;
    }

    private void lookupAndRoute(String sessionKey, ConversationState state, LocalDate today) {
        state.setAvailableSlots(lookupSlots(sessionKey, state.getExtractedInfo(), today));
        if (state.hasAvailableSlots() && state.getStage() != Stage.CONFIRMING) {
            state.setStage(Stage.PRESENTING_OPTIONS);
        }
        switch (routeAfterLookup(state)) {
            case ALTERNATIVES:
                suggestAlternatives(state, today);
                break;
            case CONFIRM:
                confirm(state);
                break;
            case RESPOND:
            default:
                break;
        }
    }

    private List<Slot> lookupSlots(String sessionKey, ExtractedInfo info, LocalDate today) {
        if (info.hasPreferredDate()) {
            LocalDate day = info.getPreferredDate();
            BusyLookupResult busy = calendarGateway.busyForDay(day);
            return slotsOrMock(sessionKey, busy, () -> availabilityEngine.slotsForDay(busy.intervals(), day), today);
        }
        Instant windowStart = today.atStartOfDay(zone).toInstant();
        Instant windowEnd = today.plusDays(lookaheadDays).atStartOfDay(zone).toInstant().minusNanos(1);
        BusyLookupResult busy = calendarGateway.busyForWindow(windowStart, windowEnd);
        return slotsOrMock(sessionKey, busy, () -> {
            List<Slot> free = availabilityEngine.freeSlots(busy.intervals(), windowStart, windowEnd, info.durationMinutes());
            return free.size() > maxSuggestions ? free.subList(0, maxSuggestions) : free;
        }, today);
    }

    /** Degrade-to-mock policy: an unreadable calendar never fails the turn. */
    private List<Slot> slotsOrMock(String sessionKey, BusyLookupResult busy, Supplier<List<Slot>> compute, LocalDate today) {
        if (busy.success()) {
            return compute.get();
        }
        log.warn("[{}] Calendar unavailable ({}); offering placeholder slots", sessionKey, busy.error());
        return availabilityEngine.mockSlots(today);
    }

    private void suggestAlternatives(ConversationState state, LocalDate today) {
        if (!state.hasAvailableSlots()) {
            state.setAvailableSlots(availabilityEngine.mockSlots(today));
        }
        state.setStage(Stage.PRESENTING_ALTERNATIVES);
    }

    /** Succeeds only when there is at least one slot on offer; otherwise stays unconfirmed. */
    private static void confirm(ConversationState state) {
        if (state.getIntent() == Intent.CONFIRM_BOOKING && state.hasAvailableSlots()) {
            state.confirmBooking();
        } else {
            state.rejectConfirmation();
        }
    }
}
