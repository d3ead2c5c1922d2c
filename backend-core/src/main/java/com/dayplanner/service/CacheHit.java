package com.dayplanner.service;

import java.util.List;

public record CacheHit(List<CalendarEvent> events, Tier tier) {

    public enum Tier {
        MEMORY,
        PERSISTENT
    }
}
