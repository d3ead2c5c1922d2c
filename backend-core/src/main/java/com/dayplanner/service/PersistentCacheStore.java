package com.dayplanner.service;

import java.time.Instant;
import java.util.Optional;

public interface PersistentCacheStore {

    Optional<CacheEntry<byte[]>> read(String key);

    void write(String key, byte[] payload, Instant writtenAt);

    void remove(String key);

    void removeIfNotNewerThan(String key, Instant writtenAt);

    void removeAll();

    int removeWrittenBefore(Instant cutoff);
}
