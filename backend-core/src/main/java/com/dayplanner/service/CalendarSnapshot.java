package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record CalendarSnapshot(
        DateRange range,
        Map<AccountKind, List<CalendarEvent>> events,
        Map<AccountKind, List<CalendarSource>> calendars,
        boolean loading,
        String errorMessage,
        long generation
) {
    public CalendarSnapshot {
        events = copyOf(events);
        calendars = copyOf(calendars);
    }

    public List<CalendarEvent> eventsFor(AccountKind account) {
        return events.getOrDefault(account, List.of());
    }

    public List<CalendarSource> calendarsFor(AccountKind account) {
        return calendars.getOrDefault(account, List.of());
    }

    private static <T> Map<AccountKind, List<T>> copyOf(Map<AccountKind, List<T>> source) {
        Map<AccountKind, List<T>> copy = new EnumMap<>(AccountKind.class);
        if (source != null) {
            source.forEach((account, values) -> copy.put(account, List.copyOf(values)));
        }
        return Collections.unmodifiableMap(copy);
    }
}
