package com.ai.scheduler.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-session dialogue state. Owned by the session store; a turn works on a
 * {@link #copy()} and the store commits it once the turn completes.
 */
public class ConversationState {

    private Stage stage = Stage.INITIAL;
    private Intent intent = Intent.GENERAL_INQUIRY;
    private ExtractedInfo extractedInfo = ExtractedInfo.empty();
    private List<Slot> availableSlots = Collections.emptyList();
    private boolean bookingConfirmed;
    private int turns;

    public Stage getStage() {
        return stage;
    }

    public void setStage(Stage stage) {
        this.stage = stage;
        if (stage != Stage.CONFIRMED) {
            this.bookingConfirmed = false;
        }
    }

    public Intent getIntent() {
        return intent;
    }

    public void setIntent(Intent intent) {
        this.intent = intent;
    }

    public ExtractedInfo getExtractedInfo() {
        return extractedInfo;
    }

    public void setExtractedInfo(ExtractedInfo extractedInfo) {
        this.extractedInfo = extractedInfo != null ? extractedInfo : ExtractedInfo.empty();
    }

    public List<Slot> getAvailableSlots() {
        return availableSlots;
    }

    /**
     * @throws IllegalArgumentException if the slots are not in chronological order
     */
    public void setAvailableSlots(List<Slot> slots) {
        if (slots == null || slots.isEmpty()) {
            this.availableSlots = Collections.emptyList();
            return;
        }
        for (int i = 1; i < slots.size(); i++) {
            if (slots.get(i).getStart().isBefore(slots.get(i - 1).getStart())) {
                throw new IllegalArgumentException("Slots must be in chronological order");
            }
        }
        this.availableSlots = Collections.unmodifiableList(new ArrayList<>(slots));
    }

    public boolean hasAvailableSlots() {
        return !availableSlots.isEmpty();
    }

    public boolean isBookingConfirmed() {
        return bookingConfirmed;
    }

    /** Marks the booking confirmed; moves the stage to {@link Stage#CONFIRMED}. */
    public void confirmBooking() {
        this.stage = Stage.CONFIRMED;
        this.bookingConfirmed = true;
    }

    public void rejectConfirmation() {
        this.bookingConfirmed = false;
    }

    /** Number of completed turns; zero for a fresh session. */
    public int getTurns() {
        return turns;
    }

    public boolean isFresh() {
        return turns == 0;
    }

    public void completeTurn() {
        turns++;
    }

    public ConversationState copy() {
        ConversationState c = new ConversationState();
        c.stage = stage;
        c.intent = intent;
        c.extractedInfo = extractedInfo;
        c.availableSlots = availableSlots;
        c.bookingConfirmed = bookingConfirmed;
        c.turns = turns;
        return c;
    }
}
