package com.ai.scheduler.service;

import com.ai.scheduler.conversation.Intent;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Keyword intent classifier. Rules are evaluated top to bottom and the first
 * match wins, regardless of where the keyword sits in the text: "no, book it"
 * is a booking request because the booking rule comes before the rejection rule.
 * Matching is case-insensitive substring containment.
 */
@Service
public class IntentClassifier {

    /** A reply that opens with an explicit yes is a confirmation, even when it repeats "book". */
    private static final Pattern LEADING_AFFIRMATIVE = Pattern.compile("^\\W*(yes|yeah|yep)\\b");

    private static final List<IntentRule> RULES = List.of(
            new IntentRule(Intent.CONFIRM_BOOKING, t -> LEADING_AFFIRMATIVE.matcher(t).find()),
            keywords(Intent.BOOK_APPOINTMENT, "book", "schedule", "appointment", "meeting", "call"),
            keywords(Intent.CHECK_AVAILABILITY, "available", "free", "time", "slot"),
            keywords(Intent.CONFIRM_BOOKING, "yes", "confirm", "book it", "that works"),
            keywords(Intent.REQUEST_ALTERNATIVES, "no", "different", "other", "alternative"),
            keywords(Intent.MODIFY_BOOKING, "cancel", "reschedule", "change")
    );

    public Intent classify(String utterance) {
        if (StringUtils.isBlank(utterance)) {
            return Intent.GENERAL_INQUIRY;
        }
        String text = utterance.toLowerCase(Locale.ROOT);
        for (IntentRule rule : RULES) {
            if (rule.matches().test(text)) {
                return rule.intent();
            }
        }
        return Intent.GENERAL_INQUIRY;
    }

    private static IntentRule keywords(Intent intent, String... words) {
        List<String> list = List.of(words);
        return new IntentRule(intent, t -> list.stream().anyMatch(t::contains));
    }

    private record IntentRule(Intent intent, Predicate<String> matches) {
    }
}
