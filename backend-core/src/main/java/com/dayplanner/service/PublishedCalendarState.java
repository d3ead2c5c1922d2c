package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class PublishedCalendarState {

    private final Map<AccountKind, List<CalendarEvent>> events = new EnumMap<>(AccountKind.class);
    private final Map<AccountKind, List<CalendarSource>> calendars = new EnumMap<>(AccountKind.class);
    private DateRange range;
    private boolean loading;
    private String errorMessage;
    private long generation;

    public synchronized long nextGeneration(DateRange requested) {
        range = requested;
        return ++generation;
    }

    public synchronized boolean beginLoading(long candidate) {
        if (candidate != generation) {
            return false;
        }
        loading = true;
        errorMessage = null;
        return true;
    }

    public synchronized boolean publish(long candidate, AccountKind account,
                                        List<CalendarSource> accountCalendars,
                                        List<CalendarEvent> accountEvents) {
        if (candidate != generation) {
            return false;
        }
        events.put(account, List.copyOf(accountEvents));
        calendars.put(account, List.copyOf(accountCalendars));
        return true;
    }

    // Keeps the calendars already published for the account.
    public synchronized boolean publishEvents(long candidate, AccountKind account, List<CalendarEvent> accountEvents) {
        if (candidate != generation) {
            return false;
        }
        events.put(account, List.copyOf(accountEvents));
        return true;
    }

    public synchronized boolean finishLoading(long candidate, String error) {
        if (candidate != generation) {
            return false;
        }
        loading = false;
        errorMessage = error;
        return true;
    }

    public synchronized void reset() {
        generation++;
        events.clear();
        calendars.clear();
        range = null;
        loading = false;
        errorMessage = null;
    }

    public synchronized CalendarSnapshot snapshot() {
        return new CalendarSnapshot(range, events, calendars, loading, errorMessage, generation);
    }
}
