package com.dayplanner.support;

import com.dayplanner.service.CacheEntry;
import com.dayplanner.service.PersistentCacheStore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryPersistentCacheStore implements PersistentCacheStore {

    private final Map<String, CacheEntry<byte[]>> rows = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public Optional<CacheEntry<byte[]>> read(String key) {
        return Optional.ofNullable(rows.get(key));
    }

    @Override
    public void write(String key, byte[] payload, Instant writtenAt) {
        writes.incrementAndGet();
        rows.put(key, new CacheEntry<>(payload, writtenAt));
    }

    @Override
    public void remove(String key) {
        rows.remove(key);
    }

    @Override
    public void removeIfNotNewerThan(String key, Instant writtenAt) {
        rows.computeIfPresent(key, (k, entry) -> entry.writtenAt().isAfter(writtenAt) ? entry : null);
    }

    @Override
    public void removeAll() {
        rows.clear();
    }

    @Override
    public int removeWrittenBefore(Instant cutoff) {
        int before = rows.size();
        rows.values().removeIf(entry -> entry.writtenAt().isBefore(cutoff));
        return before - rows.size();
    }

    public boolean contains(String key) {
        return rows.containsKey(key);
    }

    public int size() {
        return rows.size();
    }

    public int writeCount() {
        return writes.get();
    }
}
