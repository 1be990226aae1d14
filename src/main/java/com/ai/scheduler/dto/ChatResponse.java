package com.ai.scheduler.dto;

import com.ai.scheduler.conversation.ConversationState;
import com.ai.scheduler.conversation.Slot;
import com.ai.scheduler.conversation.TurnResult;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Locale;

@Getter
@Builder
public class ChatResponse {

    private final String response;

    private final String intent;

    private final String conversationStage;

    private final List<Slot> availableSlots;

    private final boolean bookingConfirmed;

    private final String sessionId;

    public static ChatResponse from(String sessionId, TurnResult result) {
        ConversationState state = result.state();
        return ChatResponse.builder()
                .response(result.responseText())
                .intent(state.getIntent().name().toLowerCase(Locale.ROOT))
                .conversationStage(state.getStage().name().toLowerCase(Locale.ROOT))
                .availableSlots(state.getAvailableSlots())
                .bookingConfirmed(state.isBookingConfirmed())
                .sessionId(sessionId)
                .build();
    }
}
