package com.dayplanner.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class CalendarFetchConfig {

    @Bean(name = "calendarFetchExecutor")
    public Executor calendarFetchExecutor(
            @Value("${app.calendar.fetch-threads:4}") int fetchThreads,
            @Value("${app.calendar.fetch-queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(2, fetchThreads);
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(10, queueCapacity));
        executor.setThreadNamePrefix("calendar-fetch-");
        executor.initialize();
        return executor;
    }

    // One thread keeps persistent cache mutations in submission order.
    @Bean(name = "cacheWriteExecutor")
    public Executor cacheWriteExecutor(@Value("${app.calendar.cache.write-queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Math.max(50, queueCapacity));
        executor.setThreadNamePrefix("cache-write-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock calendarClock(GoogleCalendarProperties properties) {
        return Clock.system(properties.safeZoneId());
    }
}
