package com.dayplanner.controller;

import com.dayplanner.config.TimelineLayoutProperties;
import com.dayplanner.domain.enums.AccountKind;
import com.dayplanner.service.CalendarEvent;
import com.dayplanner.service.CalendarOrchestrator;
import com.dayplanner.service.CalendarSnapshot;
import com.dayplanner.service.DateRange;
import com.dayplanner.service.TimelineGeometry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/calendar")
public class CalendarController {

    private final CalendarOrchestrator calendarOrchestrator;
    private final TimelineLayoutProperties layoutProperties;

    @GetMapping("/events")
    public ResponseEntity<?> events(
            @RequestParam("from") String from,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam(value = "account", required = false) String account,
            @RequestParam(value = "refresh", defaultValue = "false") boolean refresh
    ) {
        Optional<LocalDate> fromDate = parseDate(from);
        if (fromDate.isEmpty()) {
            return ResponseEntity.badRequest().body("Invalid date: " + from);
        }
        DateRange range;
        if (to == null || to.isBlank()) {
            range = DateRange.monthContaining(fromDate.get());
        } else {
            Optional<LocalDate> toDate = parseDate(to);
            if (toDate.isEmpty()) {
                return ResponseEntity.badRequest().body("Invalid date: " + to);
            }
            if (!fromDate.get().isBefore(toDate.get())) {
                return ResponseEntity.badRequest().body("'from' must be before 'to'");
            }
            range = new DateRange(fromDate.get(), toDate.get());
        }

        EnumSet<AccountKind> accounts = EnumSet.allOf(AccountKind.class);
        if (account != null && !account.isBlank()) {
            Optional<AccountKind> kind = AccountKind.fromKey(account);
            if (kind.isEmpty()) {
                return ResponseEntity.badRequest().body("Unknown account: " + account);
            }
            accounts = EnumSet.of(kind.get());
        }

        CalendarSnapshot snapshot = calendarOrchestrator.load(range, accounts, refresh).join();
        return ResponseEntity.ok(snapshot);
    }

    @GetMapping("/snapshot")
    public ResponseEntity<CalendarSnapshot> snapshot() {
        return ResponseEntity.ok(calendarOrchestrator.snapshot());
    }

    @GetMapping("/days/{date}")
    public ResponseEntity<?> day(
            @PathVariable("date") String date,
            @RequestParam(value = "account", required = false) String account
    ) {
        Optional<LocalDate> day = parseDate(date);
        if (day.isEmpty()) {
            return ResponseEntity.badRequest().body("Invalid date: " + date);
        }
        AccountKind kind = null;
        if (account != null && !account.isBlank()) {
            Optional<AccountKind> parsed = AccountKind.fromKey(account);
            if (parsed.isEmpty()) {
                return ResponseEntity.badRequest().body("Unknown account: " + account);
            }
            kind = parsed.get();
        }
        List<CalendarEvent> events = calendarOrchestrator.eventsOn(day.get(), kind);
        return ResponseEntity.ok(new DayEventsDto(day.get(), events));
    }

    @GetMapping("/days/{date}/layout")
    public ResponseEntity<?> layout(
            @PathVariable("date") String date,
            @RequestParam("width") double width,
            @RequestParam(value = "hourHeight", required = false) Double hourHeight,
            @RequestParam(value = "baseHour", required = false) Integer baseHour
    ) {
        Optional<LocalDate> day = parseDate(date);
        if (day.isEmpty()) {
            return ResponseEntity.badRequest().body("Invalid date: " + date);
        }
        if (width <= 0) {
            return ResponseEntity.badRequest().body("'width' must be positive");
        }
        if (hourHeight != null && hourHeight <= 0) {
            return ResponseEntity.badRequest().body("'hourHeight' must be positive");
        }
        if (baseHour != null && (baseHour < 0 || baseHour > 23)) {
            return ResponseEntity.badRequest().body("'baseHour' must be between 0 and 23");
        }

        TimelineGeometry geometry = layoutProperties.toGeometry(width);
        if (hourHeight != null || baseHour != null) {
            geometry = geometry.withHourWindow(
                    hourHeight == null ? geometry.hourHeight() : hourHeight,
                    baseHour == null ? geometry.baseHour() : baseHour);
        }
        return ResponseEntity.ok(calendarOrchestrator.layoutDay(day.get(), geometry));
    }

    @DeleteMapping("/months/{date}")
    public ResponseEntity<?> clearMonth(@PathVariable("date") String date) {
        Optional<LocalDate> day = parseDate(date);
        if (day.isEmpty()) {
            return ResponseEntity.badRequest().body("Invalid date: " + date);
        }
        calendarOrchestrator.clearMonth(day.get());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<?> clearAll() {
        calendarOrchestrator.clearAll();
        return ResponseEntity.noContent().build();
    }

    private Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public record DayEventsDto(LocalDate date, List<CalendarEvent> events) {
    }
}
