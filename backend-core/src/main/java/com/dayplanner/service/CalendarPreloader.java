package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
public class CalendarPreloader {

    private final RemoteCalendarClient remoteCalendarClient;
    private final AccessTokenProvider accessTokenProvider;
    private final EventCache eventCache;
    private final Executor calendarFetchExecutor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    public CalendarPreloader(RemoteCalendarClient remoteCalendarClient,
                             AccessTokenProvider accessTokenProvider,
                             EventCache eventCache,
                             @Qualifier("calendarFetchExecutor") Executor calendarFetchExecutor) {
        this.remoteCalendarClient = remoteCalendarClient;
        this.accessTokenProvider = accessTokenProvider;
        this.eventCache = eventCache;
        this.calendarFetchExecutor = calendarFetchExecutor;
    }

    public CompletableFuture<Void> warmAdjacent(LocalDate pivot) {
        DateRange month = DateRange.monthContaining(pivot);
        return warm(List.of(month.previousMonth(), month.nextMonth()));
    }

    public CompletableFuture<Void> warmTowards(LocalDate pivot, NavigationDirection direction) {
        DateRange month = DateRange.monthContaining(pivot);
        return switch (direction) {
            case FORWARD -> warm(List.of(month.nextMonth(), month.nextMonth().nextMonth(), month.previousMonth()));
            case BACKWARD -> warm(List.of(month.previousMonth(), month.previousMonth().previousMonth(), month.nextMonth()));
            case NEUTRAL -> warmAdjacent(pivot);
        };
    }

    private CompletableFuture<Void> warm(List<DateRange> months) {
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (DateRange month : months) {
            for (AccountKind account : AccountKind.values()) {
                if (!accessTokenProvider.isLinked(account)) {
                    continue;
                }
                CacheKey key = CacheKey.of(account, month);
                if (eventCache.hasValidEntry(key) || !inFlight.add(key.value())) {
                    continue;
                }
                try {
                    tasks.add(CompletableFuture.runAsync(() -> warmOne(account, month, key), calendarFetchExecutor));
                } catch (RejectedExecutionException e) {
                    inFlight.remove(key.value());
                    log.debug("Preload of {} was rejected: {}", key, e.getMessage());
                }
            }
        }
        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
    }

    private void warmOne(AccountKind account, DateRange month, CacheKey key) {
        try {
            List<CalendarSource> calendars = remoteCalendarClient.fetchCalendars(account);
            List<CalendarEvent> events = remoteCalendarClient.fetchEvents(account, month, calendars);
            eventCache.put(key, events);
            eventCache.putCalendars(key, calendars);
            log.debug("Preloaded {} events for {}", events.size(), key);
        } catch (RuntimeException e) {
            log.debug("Preload of {} failed: {}", key, e.getMessage());
        } finally {
            inFlight.remove(key.value());
        }
    }
}
