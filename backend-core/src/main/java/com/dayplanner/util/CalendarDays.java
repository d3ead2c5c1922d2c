package com.dayplanner.util;

import com.dayplanner.service.CalendarEvent;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class CalendarDays {

    private CalendarDays() {
    }

    public static Comparator<CalendarEvent> chronological(ZoneId zoneId) {
        return Comparator
                .comparing((CalendarEvent e) -> e.startInstant(zoneId), Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(e -> e.endInstant(zoneId), Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(CalendarEvent::id, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    public static List<LocalDate> daysCovered(CalendarEvent event, ZoneId zoneId) {
        if (event.start() == null || !event.start().isResolvable()) {
            return List.of();
        }
        LocalDate startDay = event.start().toLocalDate(zoneId);
        LocalDate lastDay = startDay;

        if (event.isAllDay()) {
            LocalDate exclusiveEnd = event.end() == null ? null : event.end().toLocalDate(zoneId);
            if (exclusiveEnd != null && exclusiveEnd.isAfter(startDay)) {
                lastDay = exclusiveEnd.minusDays(1);
            }
        } else {
            Instant start = event.startInstant(zoneId);
            Instant end = event.endInstant(zoneId);
            if (end != null && end.isAfter(start)) {
                ZonedDateTime zonedEnd = end.atZone(zoneId);
                LocalDate endDay = zonedEnd.toLocalDate();
                if (zonedEnd.toLocalTime().equals(LocalTime.MIDNIGHT)) {
                    endDay = endDay.minusDays(1);
                }
                if (endDay.isAfter(startDay)) {
                    lastDay = endDay;
                }
            }
        }
        return startDay.datesUntil(lastDay.plusDays(1)).toList();
    }

    public static boolean occursOn(CalendarEvent event, LocalDate day, ZoneId zoneId) {
        return daysCovered(event, zoneId).contains(day);
    }

    public static Map<LocalDate, List<CalendarEvent>> indexByDay(List<CalendarEvent> events, ZoneId zoneId) {
        Map<LocalDate, List<CalendarEvent>> byDay = new HashMap<>();
        for (CalendarEvent event : events) {
            for (LocalDate day : daysCovered(event, zoneId)) {
                byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(event);
            }
        }
        Comparator<CalendarEvent> order = chronological(zoneId);
        byDay.replaceAll((day, list) -> {
            list.sort(order);
            return List.copyOf(list);
        });
        return byDay;
    }
}
