package com.dayplanner.service;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

public record CalendarEvent(
        String id,
        String title,
        String description,
        String location,
        EventDateTime start,
        EventDateTime end,
        String sourceCalendarId,
        String recurringInstanceId,
        List<String> recurrenceRules
) {
    public CalendarEvent {
        recurrenceRules = recurrenceRules == null ? List.of() : List.copyOf(recurrenceRules);
    }

    @JsonIgnore
    public boolean isAllDay() {
        return start != null && start.isDateOnly();
    }

    @JsonIgnore
    public boolean isLikelyRecurring() {
        if (recurringInstanceId != null && !recurringInstanceId.isBlank()) {
            return true;
        }
        return !recurrenceRules.isEmpty();
    }

    public Instant startInstant(ZoneId zoneId) {
        return start == null ? null : start.toInstant(zoneId);
    }

    public Instant endInstant(ZoneId zoneId) {
        return end == null ? null : end.toInstant(zoneId);
    }

    public CalendarEvent withSourceCalendarId(String calendarId) {
        return new CalendarEvent(id, title, description, location, start, end,
                calendarId, recurringInstanceId, recurrenceRules);
    }
}
