package com.dayplanner.service;

import com.dayplanner.domain.model.CachedEventPayload;
import com.dayplanner.repository.CachedEventPayloadRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaPersistentCacheStore implements PersistentCacheStore {

    private final CachedEventPayloadRepository repository;

    @Override
    public Optional<CacheEntry<byte[]>> read(String key) {
        return repository.findById(key)
                .filter(row -> row.getPayload() != null && row.getWrittenAt() != null)
                .map(row -> new CacheEntry<>(row.getPayload(), row.getWrittenAt().toInstant()));
    }

    @Override
    public void write(String key, byte[] payload, Instant writtenAt) {
        CachedEventPayload row = repository.findById(key).orElseGet(CachedEventPayload::new);
        row.setCacheKey(key);
        row.setPayload(payload);
        row.setWrittenAt(writtenAt.atOffset(ZoneOffset.UTC));
        repository.save(row);
    }

    @Override
    public void remove(String key) {
        repository.deleteById(key);
    }

    @Override
    public void removeIfNotNewerThan(String key, Instant writtenAt) {
        repository.deleteByKeyWrittenNotAfter(key, writtenAt.atOffset(ZoneOffset.UTC));
    }

    @Override
    public void removeAll() {
        repository.deleteAllInBatch();
    }

    @Override
    public int removeWrittenBefore(Instant cutoff) {
        return repository.deleteWrittenBefore(cutoff.atOffset(ZoneOffset.UTC));
    }
}
