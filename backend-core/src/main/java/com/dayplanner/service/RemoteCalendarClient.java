package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;

import java.util.List;

public interface RemoteCalendarClient {

    List<CalendarSource> fetchCalendars(AccountKind account);

    List<CalendarEvent> fetchEvents(AccountKind account, DateRange range, List<CalendarSource> calendars);

    default List<CalendarEvent> fetchEvents(AccountKind account, DateRange range) {
        return fetchEvents(account, range, fetchCalendars(account));
    }
}
