package com.ai.scheduler.service;

import com.ai.scheduler.conversation.ExtractedInfo;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls date, time-of-day and duration hints out of an utterance.
 * Each family of patterns is tried in a fixed order and the first hit wins.
 * Hints found in this turn replace the prior ones; anything not mentioned is kept.
 */
@Service
public class DateTimeExtractor {

    private static final Pattern WEEKDAY =
            Pattern.compile("monday|tuesday|wednesday|thursday|friday|saturday|sunday");

    private static final List<Pattern> TIME_PATTERNS = List.of(
            Pattern.compile("(\\d{1,2}):(\\d{2})\\s*(am|pm)"),
            Pattern.compile("(\\d{1,2})\\s*(am|pm)"),
            Pattern.compile("(\\d{1,2})-(\\d{1,2})\\s*(am|pm)"),
            Pattern.compile("morning"),
            Pattern.compile("afternoon"),
            Pattern.compile("evening")
    );

    private static final Pattern DURATION = Pattern.compile("(\\d+)\\s*(hour|minute)");

    private static final List<DateRule> DATE_RULES = List.of(
            new DateRule(Pattern.compile("tomorrow"), (m, today) -> today.plusDays(1)),
            new DateRule(Pattern.compile("today"), (m, today) -> today),
            new DateRule(Pattern.compile("next week"), (m, today) -> today.plusWeeks(1)),
            new DateRule(WEEKDAY, (m, today) ->
                    nextOccurrence(today, DayOfWeek.valueOf(m.group().toUpperCase(Locale.ROOT))))
    );

    /**
     * @param utterance raw user text
     * @param prior     hints from earlier turns, may be null
     * @param today     the caller's current date; weekday names resolve relative to it
     */
    public ExtractedInfo extract(String utterance, ExtractedInfo prior, LocalDate today) {
        ExtractedInfo base = prior != null ? prior : ExtractedInfo.empty();
        if (StringUtils.isBlank(utterance)) {
            return base;
        }
        String text = utterance.toLowerCase(Locale.ROOT);
        ExtractedInfo.ExtractedInfoBuilder out = base.toBuilder();

        LocalDate date = detectDate(text, today);
        if (date != null) {
            out.preferredDate(date);
        }
        String time = detectTime(text);
        if (time != null) {
            out.timePreference(time);
        }
        String duration = detectDuration(text);
        if (duration != null) {
            out.duration(duration);
        } else if (StringUtils.isBlank(base.getDuration())) {
            out.duration(ExtractedInfo.DEFAULT_DURATION);
        }
        return out.build();
    }

    LocalDate detectDate(String text, LocalDate today) {
        for (DateRule rule : DATE_RULES) {
            Matcher m = rule.pattern().matcher(text);
            if (m.find()) {
                return rule.resolve().apply(m, today);
            }
        }
        return null;
    }

    /** Next future date falling on {@code weekday}; never today. */
    static LocalDate nextOccurrence(LocalDate today, DayOfWeek weekday) {
        int daysAhead = weekday.getValue() - today.getDayOfWeek().getValue();
        if (daysAhead <= 0) {
            daysAhead += 7;
        }
        return today.plusDays(daysAhead);
    }

    String detectTime(String text) {
        for (Pattern p : TIME_PATTERNS) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                return m.group();
            }
        }
        return null;
    }

    String detectDuration(String text) {
        Matcher m = DURATION.matcher(text);
        if (!m.find()) {
            return null;
        }
        String amount = m.group(1);
        String unit = m.group(2);
        return amount + " " + ("1".equals(amount) ? unit : unit + "s");
    }

    private record DateRule(Pattern pattern, BiFunction<Matcher, LocalDate, LocalDate> resolve) {
    }
}
