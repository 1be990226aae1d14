package com.ai.scheduler.service;

import com.ai.scheduler.conversation.ExtractedInfo;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class DateTimeExtractorTest {

    /** A Wednesday. */
    private static final LocalDate TODAY = LocalDate.of(2025, 1, 15);

    private final DateTimeExtractor extractor = new DateTimeExtractor();

    @Test
    public void shouldResolveRelativeDates() {
        assertEquals(TODAY.plusDays(1), extract("tomorrow works").getPreferredDate());
        assertEquals(TODAY, extract("anything today?").getPreferredDate());
        assertEquals(TODAY.plusDays(7), extract("sometime next week").getPreferredDate());
    }

    @Test
    public void shouldResolveWeekdayToNextOccurrence() {
        assertEquals(LocalDate.of(2025, 1, 17), extract("how about Friday").getPreferredDate());
        assertEquals(LocalDate.of(2025, 1, 20), extract("monday please").getPreferredDate());
    }

    @Test
    public void shouldNeverResolveWeekdayToToday() {
        assertEquals(LocalDate.of(2025, 1, 22), extract("wednesday").getPreferredDate());
    }

    @Test
    public void shouldUseFirstMatchingDateRule() {
        assertEquals(TODAY.plusDays(1), extract("friday or tomorrow").getPreferredDate());
    }

    @Test
    public void shouldKeepMatchedTimeTextVerbatim() {
        assertEquals("3:30 pm", extract("at 3:30 PM").getTimePreference());
        assertEquals("10am", extract("10am is fine").getTimePreference());
        assertEquals("afternoon", extract("tomorrow afternoon").getTimePreference());
        assertEquals("morning", extract("in the morning").getTimePreference());
    }

    @Test
    public void shouldPreferSingleHourPatternOverRange() {
        // "H am/pm" is tried before "H-H am/pm"
        assertEquals("4 pm", extract("between 2-4 pm").getTimePreference());
    }

    @Test
    public void shouldDetectDuration() {
        assertEquals("30 minutes", extract("a 30 minute chat").getDuration());
        assertEquals("2 hours", extract("for 2 hours").getDuration());
        assertEquals("1 hour", extract("just 1 hour").getDuration());
    }

    @Test
    public void shouldDefaultDurationToOneHour() {
        ExtractedInfo info = extract("hello");
        assertEquals("1 hour", info.getDuration());
        assertNull(info.getPreferredDate());
        assertNull(info.getTimePreference());
    }

    @Test
    public void shouldKeepPriorFieldsWhenNothingNewIsDetected() {
        ExtractedInfo prior = ExtractedInfo.builder()
                .preferredDate(LocalDate.of(2025, 2, 3))
                .timePreference("morning")
                .duration("2 hours")
                .build();

        ExtractedInfo merged = extractor.extract("sounds good", prior, TODAY);

        assertEquals(LocalDate.of(2025, 2, 3), merged.getPreferredDate());
        assertEquals("morning", merged.getTimePreference());
        assertEquals("2 hours", merged.getDuration());
    }

    @Test
    public void shouldOverwriteOnlyDetectedFields() {
        ExtractedInfo prior = ExtractedInfo.builder()
                .preferredDate(LocalDate.of(2025, 2, 3))
                .duration("2 hours")
                .build();

        ExtractedInfo merged = extractor.extract("make it 30 minutes at 3 pm", prior, TODAY);

        assertEquals(LocalDate.of(2025, 2, 3), merged.getPreferredDate());
        assertEquals("3 pm", merged.getTimePreference());
        assertEquals("30 minutes", merged.getDuration());
    }

    @Test
    public void shouldConvertDurationToMinutes() {
        assertEquals(120, ExtractedInfo.builder().duration("2 hours").build().durationMinutes());
        assertEquals(45, ExtractedInfo.builder().duration("45 minutes").build().durationMinutes());
        assertEquals(60, ExtractedInfo.builder().duration("a while").build().durationMinutes());
        assertEquals(60, ExtractedInfo.empty().durationMinutes());
    }

    @Test
    public void shouldFallBackToOneHourForOutOfRangeDurations() {
        assertEquals(60, extract("book a call for 99999999999 minutes").durationMinutes());
        assertEquals(60, extract("book a call for 40000000 hours").durationMinutes());
        assertEquals(60, extract("a 0 minute call").durationMinutes());
        assertEquals(60, extract("a 25 hour marathon").durationMinutes());
        assertEquals(1440, extract("block 24 hours").durationMinutes());
    }

    private ExtractedInfo extract(String utterance) {
        return extractor.extract(utterance, null, TODAY);
    }
}
