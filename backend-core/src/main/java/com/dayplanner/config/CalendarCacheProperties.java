package com.dayplanner.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.calendar.cache")
public record CalendarCacheProperties(
        Duration memoryTtl,
        Duration persistentTtl,
        @Positive Integer maxMemoryEntries
) {
    public static final Duration DEFAULT_MEMORY_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_PERSISTENT_TTL = Duration.ofHours(24);
    public static final int DEFAULT_MAX_MEMORY_ENTRIES = 6;

    public static CalendarCacheProperties defaults() {
        return new CalendarCacheProperties(null, null, null);
    }

    public Duration safeMemoryTtl() {
        return isPositive(memoryTtl) ? memoryTtl : DEFAULT_MEMORY_TTL;
    }

    public Duration safePersistentTtl() {
        return isPositive(persistentTtl) ? persistentTtl : DEFAULT_PERSISTENT_TTL;
    }

    public int safeMaxMemoryEntries() {
        return maxMemoryEntries != null && maxMemoryEntries > 0 ? maxMemoryEntries : DEFAULT_MAX_MEMORY_ENTRIES;
    }

    private boolean isPositive(Duration value) {
        return value != null && !value.isZero() && !value.isNegative();
    }
}
