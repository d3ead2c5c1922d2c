package com.dayplanner.service;

import com.dayplanner.config.CalendarCacheProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
public class EventCache {

    private static final TypeReference<List<CalendarEvent>> EVENT_LIST = new TypeReference<>() {
    };

    private final PersistentCacheStore persistentStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Executor cacheWriteExecutor;
    private final Duration memoryTtl;
    private final Duration persistentTtl;
    private final int maxMemoryEntries;

    private final Map<String, CacheEntry<List<CalendarEvent>>> memoryEvents = new HashMap<>();
    private final Map<String, CacheEntry<List<CalendarSource>>> memoryCalendars = new HashMap<>();
    private final Map<String, Instant> lastAccess = new HashMap<>();

    @Autowired
    public EventCache(PersistentCacheStore persistentStore,
                      ObjectMapper objectMapper,
                      Clock clock,
                      CalendarCacheProperties properties,
                      @Qualifier("cacheWriteExecutor") Executor cacheWriteExecutor) {
        this.persistentStore = persistentStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.cacheWriteExecutor = cacheWriteExecutor;
        this.memoryTtl = properties.safeMemoryTtl();
        this.persistentTtl = properties.safePersistentTtl();
        this.maxMemoryEntries = properties.safeMaxMemoryEntries();
    }

    public Optional<List<CalendarEvent>> get(CacheKey key) {
        return lookup(key).map(CacheHit::events);
    }

    public Optional<CacheHit> lookup(CacheKey key) {
        String cacheKey = key.value();
        Optional<List<CalendarEvent>> fromMemory = readMemory(cacheKey);
        if (fromMemory.isPresent()) {
            return Optional.of(new CacheHit(fromMemory.get(), CacheHit.Tier.MEMORY));
        }

        Optional<CacheEntry<byte[]>> stored = readPersistent(cacheKey);
        if (stored.isEmpty()) {
            dropExpiredMemory(cacheKey);
            return Optional.empty();
        }
        Instant storedAt = stored.get().writtenAt();
        if (!stored.get().isValid(clock.instant(), persistentTtl)) {
            log.debug("Persistent cache entry {} is stale, purging", cacheKey);
            purgeNotNewerThan(cacheKey, storedAt);
            return Optional.empty();
        }

        List<CalendarEvent> events;
        try {
            events = List.copyOf(objectMapper.readValue(stored.get().payload(), EVENT_LIST));
        } catch (IOException e) {
            log.warn("Failed to decode cached events for {}: {}", cacheKey, e.getMessage());
            purgeNotNewerThan(cacheKey, storedAt);
            return Optional.empty();
        }
        if (!promote(cacheKey, events, storedAt)) {
            return readMemory(cacheKey).map(fresher -> new CacheHit(fresher, CacheHit.Tier.MEMORY));
        }
        log.debug("Promoted {} events for {} from persistent cache", events.size(), cacheKey);
        return Optional.of(new CacheHit(events, CacheHit.Tier.PERSISTENT));
    }

    public void put(CacheKey key, List<CalendarEvent> events) {
        String cacheKey = key.value();
        List<CalendarEvent> snapshot = List.copyOf(events);
        Instant now = clock.instant();
        synchronized (this) {
            memoryEvents.put(cacheKey, new CacheEntry<>(snapshot, now));
            lastAccess.put(cacheKey, now);
            evictIfNeeded();
        }

        // Empty results never reach the persistent tier; an older non-empty row must not outlive them.
        if (snapshot.isEmpty()) {
            submitWrite("remove " + cacheKey, () -> persistentStore.removeIfNotNewerThan(cacheKey, now));
            return;
        }
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode events for {}: {}", cacheKey, e.getMessage());
            return;
        }
        submitWrite("write " + cacheKey, () -> persistentStore.write(cacheKey, payload, now));
    }

    public synchronized Optional<List<CalendarSource>> getCalendars(CacheKey key) {
        String cacheKey = key.value();
        CacheEntry<List<CalendarSource>> entry = memoryCalendars.get(cacheKey);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isValid(clock.instant(), memoryTtl)) {
            memoryCalendars.remove(cacheKey);
            return Optional.empty();
        }
        return Optional.of(entry.payload());
    }

    public synchronized void putCalendars(CacheKey key, List<CalendarSource> calendars) {
        memoryCalendars.put(key.value(), new CacheEntry<>(List.copyOf(calendars), clock.instant()));
    }

    // Same answer as get, without decoding or promoting.
    public boolean hasValidEntry(CacheKey key) {
        String cacheKey = key.value();
        synchronized (this) {
            CacheEntry<List<CalendarEvent>> entry = memoryEvents.get(cacheKey);
            if (entry != null && entry.isValid(clock.instant(), memoryTtl)) {
                return true;
            }
        }
        return readPersistent(cacheKey)
                .map(stored -> stored.isValid(clock.instant(), persistentTtl))
                .orElse(false);
    }

    public void invalidate(CacheKey key) {
        purge(key.value());
    }

    public void clearAll() {
        synchronized (this) {
            memoryEvents.clear();
            memoryCalendars.clear();
            lastAccess.clear();
        }
        submitWrite("clear", persistentStore::removeAll);
    }

    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(persistentTtl);
        submitWrite("purge entries written before " + cutoff, () -> {
            int removed = persistentStore.removeWrittenBefore(cutoff);
            if (removed > 0) {
                log.info("Purged {} expired persistent cache entries", removed);
            }
        });
    }

    private synchronized Optional<List<CalendarEvent>> readMemory(String cacheKey) {
        CacheEntry<List<CalendarEvent>> entry = memoryEvents.get(cacheKey);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (!entry.isValid(now, memoryTtl)) {
            return Optional.empty();
        }
        lastAccess.put(cacheKey, now);
        return Optional.of(entry.payload());
    }

    // A put that landed after the persistent read wins over the row being promoted.
    private synchronized boolean promote(String cacheKey, List<CalendarEvent> events, Instant storedAt) {
        if (hasNewerMemoryEntry(cacheKey, storedAt)) {
            return false;
        }
        Instant now = clock.instant();
        memoryEvents.put(cacheKey, new CacheEntry<>(events, now));
        lastAccess.put(cacheKey, now);
        evictIfNeeded();
        return true;
    }

    private synchronized void dropExpiredMemory(String cacheKey) {
        if (!hasNewerMemoryEntry(cacheKey, Instant.MIN)) {
            dropMemory(cacheKey);
        }
    }

    private synchronized void dropMemory(String cacheKey) {
        memoryEvents.remove(cacheKey);
        memoryCalendars.remove(cacheKey);
        lastAccess.remove(cacheKey);
    }

    private void purge(String cacheKey) {
        dropMemory(cacheKey);
        submitWrite("remove " + cacheKey, () -> persistentStore.remove(cacheKey));
    }

    // Removes only what was written at or before storedAt, so a concurrent put survives.
    private void purgeNotNewerThan(String cacheKey, Instant storedAt) {
        synchronized (this) {
            if (!hasNewerMemoryEntry(cacheKey, storedAt)) {
                dropMemory(cacheKey);
            }
        }
        submitWrite("remove " + cacheKey, () -> persistentStore.removeIfNotNewerThan(cacheKey, storedAt));
    }

    // Caller holds the monitor.
    private boolean hasNewerMemoryEntry(String cacheKey, Instant storedAt) {
        CacheEntry<List<CalendarEvent>> entry = memoryEvents.get(cacheKey);
        return entry != null
                && entry.writtenAt().isAfter(storedAt)
                && entry.isValid(clock.instant(), memoryTtl);
    }

    // Caller holds the monitor. Only the memory tier is evicted.
    private void evictIfNeeded() {
        while (memoryEvents.size() > maxMemoryEntries) {
            String oldest = null;
            Instant oldestAccess = null;
            for (String cacheKey : memoryEvents.keySet()) {
                Instant accessed = lastAccess.getOrDefault(cacheKey, Instant.MIN);
                if (oldestAccess == null || accessed.isBefore(oldestAccess)) {
                    oldest = cacheKey;
                    oldestAccess = accessed;
                }
            }
            memoryEvents.remove(oldest);
            memoryCalendars.remove(oldest);
            lastAccess.remove(oldest);
            log.debug("Evicted {} from memory cache", oldest);
        }
    }

    private Optional<CacheEntry<byte[]>> readPersistent(String cacheKey) {
        try {
            return persistentStore.read(cacheKey);
        } catch (RuntimeException e) {
            log.warn("Failed to read persistent cache entry {}: {}", cacheKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void submitWrite(String description, Runnable action) {
        try {
            cacheWriteExecutor.execute(() -> {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.error("Failed to {} in persistent cache: {}", description, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Persistent cache {} was rejected: {}", description, e.getMessage());
        }
    }
}
