package com.ai.scheduler.config;

import com.ai.scheduler.calendar.CalendarProvider;
import com.ai.scheduler.calendar.InMemoryCalendarProvider;
import com.ai.scheduler.conversation.BusyInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    /** Wall clock for the REST edge only; the conversation core takes "now" as an argument. */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock(SchedulerProperties properties) {
        return Clock.system(properties.zoneId());
    }

    @Bean(name = "calendarLookupExecutor", destroyMethod = "shutdownNow")
    public ExecutorService calendarLookupExecutor(SchedulerProperties properties) {
        AtomicInteger index = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("calendar-lookup-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(properties.getCalendar().getLookupThreads(), 1), threadFactory);
    }

    @Bean
    @ConditionalOnMissingBean(CalendarProvider.class)
    public CalendarProvider calendarProvider(SchedulerProperties properties) {
        List<BusyInterval> seed = properties.getCalendar().getBusy().stream()
                .map(s -> new BusyInterval(Instant.parse(s.getStart()), Instant.parse(s.getEnd())))
                .collect(Collectors.toList());
        log.info("In-memory calendar seeded with {} busy intervals (zone={})", seed.size(), properties.getZone());
        return new InMemoryCalendarProvider(properties.zoneId(), seed);
    }
}
