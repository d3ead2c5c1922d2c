package com.dayplanner.service;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<T>(T payload, Instant writtenAt) {

    public boolean isValid(Instant now, Duration ttl) {
        return Duration.between(writtenAt, now).compareTo(ttl) < 0;
    }
}
