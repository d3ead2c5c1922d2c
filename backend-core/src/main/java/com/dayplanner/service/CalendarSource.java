package com.dayplanner.service;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record CalendarSource(
        String id,
        String displayName,
        String foregroundColor,
        String backgroundColor,
        Boolean primary
) {
    @JsonIgnore
    public boolean isPrimaryCalendar() {
        return Boolean.TRUE.equals(primary);
    }
}
