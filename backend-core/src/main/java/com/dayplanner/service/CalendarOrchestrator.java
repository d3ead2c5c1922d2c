package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;
import com.dayplanner.util.CalendarDays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
public class CalendarOrchestrator {

    static final String BOTH_ACCOUNTS_FAILED = "Failed to load calendar data for both accounts";

    private final RemoteCalendarClient remoteCalendarClient;
    private final AccessTokenProvider accessTokenProvider;
    private final EventCache eventCache;
    private final CalendarPreloader preloader;
    private final PublishedCalendarState state;
    private final TimelineLayoutEngine layoutEngine;
    private final Executor calendarFetchExecutor;
    private final ZoneId zoneId;

    private LocalDate lastRangeStart;
    private NavigationDirection direction = NavigationDirection.NEUTRAL;

    @Autowired
    public CalendarOrchestrator(RemoteCalendarClient remoteCalendarClient,
                                AccessTokenProvider accessTokenProvider,
                                EventCache eventCache,
                                CalendarPreloader preloader,
                                PublishedCalendarState state,
                                TimelineLayoutEngine layoutEngine,
                                @Qualifier("calendarFetchExecutor") Executor calendarFetchExecutor,
                                Clock clock) {
        this.remoteCalendarClient = remoteCalendarClient;
        this.accessTokenProvider = accessTokenProvider;
        this.eventCache = eventCache;
        this.preloader = preloader;
        this.state = state;
        this.layoutEngine = layoutEngine;
        this.calendarFetchExecutor = calendarFetchExecutor;
        this.zoneId = clock.getZone();
    }

    public CompletableFuture<CalendarSnapshot> load(DateRange range) {
        return load(range, EnumSet.allOf(AccountKind.class), false);
    }

    // A superseded generation still fills the cache but publishes nothing.
    public CompletableFuture<CalendarSnapshot> load(DateRange range, Set<AccountKind> accounts, boolean forceRefresh) {
        long generation = state.nextGeneration(range);
        NavigationDirection navigation = trackDirection(range);

        List<AccountKind> linked = Arrays.stream(AccountKind.values())
                .filter(accounts::contains)
                .filter(accessTokenProvider::isLinked)
                .toList();

        List<AccountKind> toFetch = new ArrayList<>();
        for (AccountKind account : linked) {
            CacheKey key = CacheKey.of(account, range);
            Optional<List<CalendarEvent>> cached = forceRefresh ? Optional.empty() : eventCache.get(key);
            if (cached.isPresent()) {
                Optional<List<CalendarSource>> calendars = eventCache.getCalendars(key);
                if (calendars.isPresent()) {
                    state.publish(generation, account, calendars.get(), cached.get());
                } else {
                    state.publishEvents(generation, account, cached.get());
                }
            } else {
                toFetch.add(account);
            }
        }
        if (toFetch.isEmpty()) {
            log.debug("Served range {}..{} from cache", range.start(), range.end());
            return CompletableFuture.completedFuture(state.snapshot());
        }

        state.beginLoading(generation);
        Map<AccountKind, CompletableFuture<Optional<RuntimeException>>> tasks = new EnumMap<>(AccountKind.class);
        for (AccountKind account : toFetch) {
            try {
                tasks.put(account, CompletableFuture.supplyAsync(
                        () -> fetchAndPublish(generation, account, range), calendarFetchExecutor));
            } catch (RejectedExecutionException e) {
                log.error("Failed to schedule calendar fetch for account={}: {}", account.key(), e.getMessage());
                tasks.put(account, CompletableFuture.completedFuture(Optional.of(e)));
            }
        }

        return CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<AccountKind, RuntimeException> errors = new EnumMap<>(AccountKind.class);
                    tasks.forEach((account, task) -> task.join().ifPresent(error -> errors.put(account, error)));

                    String errorMessage = aggregateErrors(linked, errors);
                    boolean current = state.finishLoading(generation, errorMessage);
                    if (current && errorMessage == null) {
                        preloader.warmTowards(range.start(), navigation);
                    }
                    return state.snapshot();
                });
    }

    public List<CalendarEvent> eventsOn(LocalDate date, AccountKind account) {
        CalendarSnapshot snapshot = state.snapshot();
        List<CalendarEvent> selected = new ArrayList<>();
        for (AccountKind candidate : AccountKind.values()) {
            if (account == null || account == candidate) {
                selected.addAll(snapshot.eventsFor(candidate));
            }
        }
        return CalendarDays.indexByDay(selected, zoneId).getOrDefault(date, List.of());
    }

    public TimelineLayout layoutDay(LocalDate date, TimelineGeometry geometry) {
        CalendarSnapshot snapshot = state.snapshot();
        List<TimelineEvent> events = new ArrayList<>();
        for (AccountKind account : AccountKind.values()) {
            for (CalendarEvent event : snapshot.eventsFor(account)) {
                if (CalendarDays.occursOn(event, date, zoneId)) {
                    events.add(new TimelineEvent(event, account));
                }
            }
        }
        return layoutEngine.layoutDay(date, events, geometry);
    }

    public void clearMonth(LocalDate date) {
        DateRange month = DateRange.monthContaining(date);
        for (AccountKind account : AccountKind.values()) {
            eventCache.invalidate(CacheKey.of(account, month));
        }
        log.info("Cleared cached month {}", month.start());
    }

    public void clearAll() {
        eventCache.clearAll();
        state.reset();
        synchronized (this) {
            lastRangeStart = null;
            direction = NavigationDirection.NEUTRAL;
        }
        log.info("Cleared all cached and published calendar data");
    }

    public CalendarSnapshot snapshot() {
        return state.snapshot();
    }

    static String aggregateErrors(List<AccountKind> linked, Map<AccountKind, RuntimeException> errors) {
        if (errors.isEmpty()) {
            return null;
        }
        if (linked.size() > 1) {
            return errors.keySet().containsAll(linked) ? BOTH_ACCOUNTS_FAILED : null;
        }
        return errors.values().iterator().next().getMessage();
    }

    private Optional<RuntimeException> fetchAndPublish(long generation, AccountKind account, DateRange range) {
        CacheKey key = CacheKey.of(account, range);
        try {
            List<CalendarSource> calendars = remoteCalendarClient.fetchCalendars(account);
            List<CalendarEvent> events = remoteCalendarClient.fetchEvents(account, range, calendars);
            eventCache.put(key, events);
            eventCache.putCalendars(key, calendars);
            if (!state.publish(generation, account, calendars, events)) {
                log.debug("Discarding superseded result for {}", key);
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Failed to load calendar data for account={}: {}", account.key(), e.getMessage());
            return Optional.of(e);
        }
    }

    // Keeps the previous direction when the same range is requested again.
    private synchronized NavigationDirection trackDirection(DateRange range) {
        if (lastRangeStart != null) {
            int cmp = range.start().compareTo(lastRangeStart);
            if (cmp > 0) {
                direction = NavigationDirection.FORWARD;
            } else if (cmp < 0) {
                direction = NavigationDirection.BACKWARD;
            }
        }
        lastRangeStart = range.start();
        return direction;
    }
}
