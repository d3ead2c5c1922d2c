package com.dayplanner.service;

import java.time.LocalDate;
import java.util.List;

public record TimelineLayout(
        LocalDate day,
        AllDayLayout allDay,
        List<EventLayout> events,
        CurrentTimeIndicator currentTime
) {
    public TimelineLayout {
        events = List.copyOf(events);
    }

    public boolean hasCurrentTime() {
        return currentTime != null;
    }
}
