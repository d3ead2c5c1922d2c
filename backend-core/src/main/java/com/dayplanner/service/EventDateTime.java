package com.dayplanner.service;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public record EventDateTime(
        LocalDate date,
        Instant dateTime,
        String timeZone
) {
    public static EventDateTime ofDate(LocalDate date) {
        return new EventDateTime(date, null, null);
    }

    public static EventDateTime ofInstant(Instant dateTime, String timeZone) {
        return new EventDateTime(null, dateTime, timeZone);
    }

    @JsonIgnore
    public boolean isDateOnly() {
        return date != null;
    }

    @JsonIgnore
    public boolean isResolvable() {
        return date != null || dateTime != null;
    }

    public Instant toInstant(ZoneId zoneId) {
        if (dateTime != null) {
            return dateTime;
        }
        if (date != null) {
            return date.atStartOfDay(zoneId).toInstant();
        }
        return null;
    }

    public LocalDate toLocalDate(ZoneId zoneId) {
        if (date != null) {
            return date;
        }
        if (dateTime != null) {
            return dateTime.atZone(zoneId).toLocalDate();
        }
        return null;
    }
}
