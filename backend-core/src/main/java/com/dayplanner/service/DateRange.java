package com.dayplanner.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Range bounds must not be null");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Range start " + start + " must be before end " + end);
        }
    }

    public static DateRange monthContaining(LocalDate date) {
        LocalDate first = date.withDayOfMonth(1);
        return new DateRange(first, first.plusMonths(1));
    }

    public DateRange previousMonth() {
        return monthContaining(start.withDayOfMonth(1).minusMonths(1));
    }

    public DateRange nextMonth() {
        return monthContaining(start.withDayOfMonth(1).plusMonths(1));
    }

    public Instant timeMin(ZoneId zoneId) {
        return start.atStartOfDay(zoneId).toInstant();
    }

    public Instant timeMax(ZoneId zoneId) {
        return end.atStartOfDay(zoneId).toInstant();
    }
}
