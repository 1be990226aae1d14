package com.ai.scheduler.calendar;

import com.ai.scheduler.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Bounded-time access to the {@link CalendarProvider}. Every failure mode
 * (provider exception, timeout, interruption, saturated pool) comes back as a
 * typed provider error; nothing is thrown.
 */
@Component
public class CalendarGateway {

    private static final Logger log = LoggerFactory.getLogger(CalendarGateway.class);

    private final CalendarProvider provider;
    private final ExecutorService executor;
    private final long timeoutMs;

    public CalendarGateway(CalendarProvider provider,
                           @Qualifier("calendarLookupExecutor") ExecutorService executor,
                           SchedulerProperties properties) {
        this.provider = provider;
        this.executor = executor;
        this.timeoutMs = properties.getCalendar().getTimeoutMs();
    }

    public BusyLookupResult busyForDay(LocalDate day) {
        return call("busy lookup for day " + day, () -> provider.listBusyIntervals(day),
                intervals -> BusyLookupResult.success(intervals), BusyLookupResult::providerError);
    }

    public BusyLookupResult busyForWindow(Instant windowStart, Instant windowEnd) {
        return call("busy lookup for window " + windowStart + ".." + windowEnd,
                () -> provider.listBusyIntervals(windowStart, windowEnd),
                intervals -> BusyLookupResult.success(intervals), BusyLookupResult::providerError);
    }

    public BookingResult book(Instant start, Instant end, String summary, String description) {
        return call("booking " + start + ".." + end,
                () -> provider.createEvent(start, end, summary, description),
                BookingResult::booked, BookingResult::providerError);
    }

    public EventListResult upcomingEvents(Instant from, int maxResults) {
        return call("event listing from " + from,
                () -> provider.listUpcomingEvents(from, maxResults),
                events -> EventListResult.success(events), EventListResult::providerError);
    }

    private <T, R> R call(String what, Callable<T> call, Function<T, R> onSuccess, Function<String, R> onError) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            log.warn("Calendar {} rejected: {}", what, e.getMessage());
            return onError.apply("lookup rejected");
        }
        try {
            return onSuccess.apply(future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Calendar {} timed out after {} ms", what, timeoutMs);
            return onError.apply("timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Calendar {} failed", what, cause);
            return onError.apply(String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Calendar {} interrupted", what);
            return onError.apply("interrupted");
        }
    }
}
