package com.dayplanner.repository;

import com.dayplanner.domain.model.CachedEventPayload;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

public interface CachedEventPayloadRepository extends JpaRepository<CachedEventPayload, String> {

    @Modifying
    @Transactional
    @Query("delete from CachedEventPayload p where p.writtenAt < :cutoff")
    int deleteWrittenBefore(@Param("cutoff") OffsetDateTime cutoff);

    @Modifying
    @Transactional
    @Query("delete from CachedEventPayload p where p.cacheKey = :cacheKey and p.writtenAt <= :writtenAt")
    int deleteByKeyWrittenNotAfter(@Param("cacheKey") String cacheKey, @Param("writtenAt") OffsetDateTime writtenAt);
}
