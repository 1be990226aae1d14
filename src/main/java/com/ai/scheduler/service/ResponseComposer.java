package com.ai.scheduler.service;

import com.ai.scheduler.component.ResponsePhrases;
import com.ai.scheduler.conversation.ConversationState;
import com.ai.scheduler.conversation.Intent;
import com.ai.scheduler.conversation.Slot;
import com.ai.scheduler.conversation.Stage;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Renders the state a turn ends in. Templates are checked in order and the first
 * applicable one is used: confirmation, then stage-based listings, then intent-based
 * replies, then the greeting.
 */
@Service
public class ResponseComposer {

    private static final int OPTIONS_SHOWN = 3;

    private final List<Template> templates;

    public ResponseComposer(ResponsePhrases phrases) {
        this.templates = List.of(
                new Template("confirmed",
                        ConversationState::isBookingConfirmed,
                        s -> phrases.bookingConfirmed()),
                new Template("presenting-options",
                        s -> s.getStage() == Stage.PRESENTING_OPTIONS && s.hasAvailableSlots(),
                        s -> listing(phrases.optionsIntro(), window(s.getAvailableSlots(), 0), phrases.optionsOutro())),
                new Template("presenting-alternatives",
                        s -> s.getStage() == Stage.PRESENTING_ALTERNATIVES,
                        s -> listing(phrases.alternativesIntro(), window(s.getAvailableSlots(), OPTIONS_SHOWN), phrases.alternativesOutro())),
                new Template("availability",
                        s -> s.getIntent() == Intent.CHECK_AVAILABILITY && s.hasAvailableSlots(),
                        s -> listing(phrases.availabilityIntro(), window(s.getAvailableSlots(), 0), phrases.availabilityOutro())),
                new Template("no-availability",
                        s -> s.getIntent() == Intent.CHECK_AVAILABILITY,
                        s -> phrases.noAvailability()),
                new Template("book-appointment",
                        s -> s.getIntent() == Intent.BOOK_APPOINTMENT,
                        s -> s.getExtractedInfo().hasPreferredDate()
                                ? phrases.checkingRequestedTime()
                                : phrases.askPreferredDate()),
                new Template("greeting",
                        s -> true,
                        s -> phrases.greeting())
        );
    }

    public String compose(ConversationState state) {
        return select(state).render().apply(state);
    }

    /** Name of the template that {@link #compose} would use. */
    public String templateFor(ConversationState state) {
        return select(state).name();
    }

    private Template select(ConversationState state) {
        for (Template t : templates) {
            if (t.applies().test(state)) {
                return t;
            }
        }
        throw new IllegalStateException("No response template for stage " + state.getStage());
    }

    /** Up to three slots starting at {@code from}; empty when there are not that many. */
    private static List<Slot> window(List<Slot> slots, int from) {
        if (from >= slots.size()) {
            return List.of();
        }
        return slots.subList(from, Math.min(from + OPTIONS_SHOWN, slots.size()));
    }

    private static String listing(String intro, List<Slot> slots, String outro) {
        StringBuilder sb = new StringBuilder(intro).append("\n\n");
        int n = 1;
        for (Slot slot : slots) {
            sb.append(n++).append(". ")
                    .append(slot.getDateLabel()).append(" at ").append(slot.getTimeLabel())
                    .append(" (").append(slot.getDurationLabel()).append(")\n");
        }
        return sb.append("\n").append(outro).toString();
    }

    private record Template(String name, Predicate<ConversationState> applies, Function<ConversationState, String> render) {
    }
}
