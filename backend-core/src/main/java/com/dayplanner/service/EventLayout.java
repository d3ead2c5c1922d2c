package com.dayplanner.service;

public record EventLayout(
        CalendarEvent event,
        double verticalOffset,
        double height,
        double columnWidth,
        double horizontalOffset,
        boolean personal,
        int column,
        int columnCount,
        int cluster
) {
}
