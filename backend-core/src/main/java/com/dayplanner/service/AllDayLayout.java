package com.dayplanner.service;

import java.util.List;

public record AllDayLayout(List<AllDayRow> rows, double blockHeight) {

    public static final AllDayLayout EMPTY = new AllDayLayout(List.of(), 0);

    public AllDayLayout {
        rows = List.copyOf(rows);
    }

    public record AllDayRow(CalendarEvent event, boolean personal, double verticalOffset, double height, double width) {
    }
}
