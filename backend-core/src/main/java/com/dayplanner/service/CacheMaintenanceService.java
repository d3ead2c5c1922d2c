package com.dayplanner.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CacheMaintenanceService {

    private final EventCache eventCache;

    @Scheduled(fixedDelayString = "${app.calendar.cache.purge-interval-ms:3600000}",
            initialDelayString = "${app.calendar.cache.purge-initial-delay-ms:60000}")
    public void purgeExpiredEntries() {
        log.debug("Scheduling purge of expired persistent cache entries");
        eventCache.purgeExpired();
    }
}
