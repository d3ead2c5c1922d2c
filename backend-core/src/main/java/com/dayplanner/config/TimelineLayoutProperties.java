package com.dayplanner.config;

import com.dayplanner.service.TimelineGeometry;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.calendar.layout")
public record TimelineLayoutProperties(
        @Positive Double hourHeight,
        @Min(0) @Max(23) Integer baseHour,
        @Min(1) @Max(24) Integer endHour,
        Double minEventHeight,
        Double columnGap,
        Double allDayRowHeight,
        Double allDayRowPadding,
        Boolean clipIndicatorToWindow
) {
    public TimelineGeometry toGeometry(double columnWidth) {
        return new TimelineGeometry(
                positiveOr(hourHeight, TimelineGeometry.DEFAULT_HOUR_HEIGHT),
                hourOr(baseHour, 0),
                Math.max(hourOr(baseHour, 0), hourOr(endHour, 24)),
                columnWidth,
                positiveOr(minEventHeight, TimelineGeometry.DEFAULT_MIN_EVENT_HEIGHT),
                nonNegativeOr(columnGap, TimelineGeometry.DEFAULT_COLUMN_GAP),
                positiveOr(allDayRowHeight, TimelineGeometry.DEFAULT_ALL_DAY_ROW_HEIGHT),
                nonNegativeOr(allDayRowPadding, TimelineGeometry.DEFAULT_ALL_DAY_ROW_PADDING),
                clipIndicatorToWindow == null || clipIndicatorToWindow
        );
    }

    private double positiveOr(Double value, double fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private double nonNegativeOr(Double value, double fallback) {
        return value != null && value >= 0 ? value : fallback;
    }

    private int hourOr(Integer value, int fallback) {
        return value != null && value >= 0 && value <= 24 ? value : fallback;
    }
}
