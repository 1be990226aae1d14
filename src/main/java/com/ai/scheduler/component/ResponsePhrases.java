package com.ai.scheduler.component;

import org.springframework.stereotype.Component;

/**
 * Canned assistant replies. Slot listings are appended by the composer.
 */
@Component
public class ResponsePhrases {

    public String bookingConfirmed() {
        return "Great! I've confirmed your appointment. You should receive a confirmation email shortly. "
                + "Is there anything else I can help you with?";
    }

    public String optionsIntro() {
        return "I found some available time slots for you:";
    }

    public String optionsOutro() {
        return "Which time works best for you? Just let me know the number or tell me if you'd like to see other options.";
    }

    public String alternativesIntro() {
        return "Let me suggest some alternative times:";
    }

    public String alternativesOutro() {
        return "Do any of these work better for you?";
    }

    public String availabilityIntro() {
        return "I have several time slots available. Here are some options:";
    }

    public String availabilityOutro() {
        return "Would you like to book one of these slots?";
    }

    public String noAvailability() {
        return "I don't see any available slots for your preferred time. Could you suggest an alternative time or date?";
    }

    public String askPreferredDate() {
        return "I'd be happy to help you schedule an appointment! When would you like to meet? "
                + "Please let me know your preferred date and time.";
    }

    public String checkingRequestedTime() {
        return "Let me check availability for your requested time...";
    }

    public String greeting() {
        return "Hello! I'm here to help you schedule appointments. When would you like to book a meeting? "
                + "You can say something like 'I want to schedule a call for tomorrow afternoon' "
                + "or 'Do you have any free time this Friday?'";
    }
}
