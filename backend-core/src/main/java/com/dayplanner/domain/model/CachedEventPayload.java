package com.dayplanner.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "calendar_event_cache", indexes = {
        @Index(name = "idx_calendar_event_cache_written", columnList = "written_at")
})
public class CachedEventPayload {

    @Id
    @Column(name = "cache_key", length = 120)
    private String cacheKey;

    @Column(name = "payload", nullable = false, columnDefinition = "bytea")
    private byte[] payload;

    @Column(name = "written_at", nullable = false)
    private OffsetDateTime writtenAt;
}
