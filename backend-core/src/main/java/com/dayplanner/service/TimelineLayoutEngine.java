package com.dayplanner.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class TimelineLayoutEngine {

    static final double MIN_ALL_DAY_BLOCK_HEIGHT = 20;

    private final Clock clock;

    public TimelineLayout layoutDay(LocalDate day, List<TimelineEvent> events, TimelineGeometry geometry) {
        ZoneId zoneId = clock.getZone();
        List<TimelineEvent> allDay = new ArrayList<>();
        List<Slot> timed = new ArrayList<>();

        Instant dayStart = day.atStartOfDay(zoneId).toInstant();
        Instant dayEnd = day.plusDays(1).atStartOfDay(zoneId).toInstant();
        for (TimelineEvent candidate : events) {
            CalendarEvent event = candidate.event();
            if (event.isAllDay()) {
                allDay.add(candidate);
                continue;
            }
            Slot slot = clip(candidate, dayStart, dayEnd, zoneId, geometry);
            if (slot != null) {
                timed.add(slot);
            }
        }

        timed.sort(Comparator
                .comparing((Slot s) -> s.start)
                .thenComparing(s -> s.end)
                .thenComparing(s -> s.source.event().id(), Comparator.nullsLast(Comparator.naturalOrder())));

        return new TimelineLayout(
                day,
                layoutAllDay(allDay, geometry),
                layoutTimed(cluster(timed), zoneId, geometry),
                currentTimeIndicator(day, geometry)
        );
    }

    AllDayLayout layoutAllDay(List<TimelineEvent> allDay, TimelineGeometry geometry) {
        if (allDay.isEmpty()) {
            return AllDayLayout.EMPTY;
        }
        double rowStep = geometry.allDayRowHeight() + geometry.allDayRowPadding();
        List<AllDayLayout.AllDayRow> rows = new ArrayList<>();
        for (int i = 0; i < allDay.size(); i++) {
            TimelineEvent row = allDay.get(i);
            rows.add(new AllDayLayout.AllDayRow(row.event(), row.isPersonal(),
                    i * rowStep, geometry.allDayRowHeight(), geometry.columnWidth()));
        }
        return new AllDayLayout(rows, Math.max(MIN_ALL_DAY_BLOCK_HEIGHT, allDay.size() * rowStep));
    }

    CurrentTimeIndicator currentTimeIndicator(LocalDate day, TimelineGeometry geometry) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        if (!now.toLocalDate().equals(day)) {
            return null;
        }
        int hour = now.getHour();
        if (geometry.clipIndicatorToWindow() && (hour < geometry.baseHour() || hour > geometry.endHour())) {
            return null;
        }
        LocalTime time = now.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        return new CurrentTimeIndicator(geometry.offsetOf(hour, now.getMinute()), time);
    }

    private Slot clip(TimelineEvent candidate, Instant dayStart, Instant dayEnd, ZoneId zoneId, TimelineGeometry geometry) {
        CalendarEvent event = candidate.event();
        Instant start = event.startInstant(zoneId);
        if (start == null) {
            log.debug("Skipping event {} without a start", event.id());
            return null;
        }
        Instant end = event.endInstant(zoneId);
        if (end == null || end.isBefore(start)) {
            end = start;
        }
        if (!start.isBefore(dayEnd) || end.isBefore(dayStart) || (end.equals(dayStart) && start.isBefore(dayStart))) {
            return null;
        }

        Instant clippedStart = start.isBefore(dayStart) ? dayStart : start;
        Instant clippedEnd = end.isAfter(dayEnd) ? dayEnd : end;
        int startHour = clippedStart.atZone(zoneId).getHour();
        if (startHour < geometry.baseHour() || startHour > geometry.endHour()) {
            return null;
        }
        return new Slot(candidate, clippedStart, clippedEnd);
    }

    // Greedy: an event joins the first cluster holding an overlapping member.
    private List<List<Slot>> cluster(List<Slot> sorted) {
        List<List<Slot>> clusters = new ArrayList<>();
        for (Slot slot : sorted) {
            List<Slot> target = null;
            for (List<Slot> cluster : clusters) {
                if (cluster.stream().anyMatch(member -> member.overlaps(slot))) {
                    target = cluster;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                clusters.add(target);
            }
            target.add(slot);
        }
        return clusters;
    }

    private List<EventLayout> layoutTimed(List<List<Slot>> clusters, ZoneId zoneId, TimelineGeometry geometry) {
        List<EventLayout> layouts = new ArrayList<>();
        for (int c = 0; c < clusters.size(); c++) {
            List<Slot> cluster = clusters.get(c);
            int columns = cluster.size();
            double band = geometry.columnWidth() / columns;
            double width = Math.max(0, band - geometry.columnGap());
            for (int i = 0; i < columns; i++) {
                Slot slot = cluster.get(i);
                ZonedDateTime localStart = slot.start.atZone(zoneId);
                long minutes = Duration.between(slot.start, slot.end).toMinutes();
                layouts.add(new EventLayout(
                        slot.source.event(),
                        geometry.offsetOf(localStart.getHour(), localStart.getMinute()),
                        geometry.heightOf(minutes),
                        width,
                        i * band + geometry.columnGap() / 2,
                        slot.source.isPersonal(),
                        i,
                        columns,
                        c
                ));
            }
        }
        return layouts;
    }

    private record Slot(TimelineEvent source, Instant start, Instant end) {

        // Half-open intervals; touching events do not overlap.
        boolean overlaps(Slot other) {
            return start.isBefore(other.end) && other.start.isBefore(end);
        }
    }
}
