package com.dayplanner.service;

public record TimelineGeometry(
        double hourHeight,
        int baseHour,
        int endHour,
        double columnWidth,
        double minEventHeight,
        double columnGap,
        double allDayRowHeight,
        double allDayRowPadding,
        boolean clipIndicatorToWindow
) {
    public static final double DEFAULT_HOUR_HEIGHT = 60;
    public static final double DEFAULT_MIN_EVENT_HEIGHT = 20;
    public static final double DEFAULT_COLUMN_GAP = 4;
    public static final double DEFAULT_ALL_DAY_ROW_HEIGHT = 20;
    public static final double DEFAULT_ALL_DAY_ROW_PADDING = 4;

    public TimelineGeometry {
        if (hourHeight <= 0) {
            throw new IllegalArgumentException("hourHeight must be positive");
        }
        if (columnWidth < 0) {
            throw new IllegalArgumentException("columnWidth must not be negative");
        }
        if (baseHour < 0 || endHour > 24 || baseHour > endHour) {
            throw new IllegalArgumentException("Invalid hour window " + baseHour + ".." + endHour);
        }
    }

    public static TimelineGeometry of(double hourHeight, int baseHour, double columnWidth) {
        return new TimelineGeometry(hourHeight, baseHour, 24, columnWidth,
                DEFAULT_MIN_EVENT_HEIGHT, DEFAULT_COLUMN_GAP,
                DEFAULT_ALL_DAY_ROW_HEIGHT, DEFAULT_ALL_DAY_ROW_PADDING, true);
    }

    public TimelineGeometry withHourWindow(double height, int base) {
        return new TimelineGeometry(height, base, Math.max(base, endHour), columnWidth, minEventHeight,
                columnGap, allDayRowHeight, allDayRowPadding, clipIndicatorToWindow);
    }

    public double offsetOf(int hour, int minute) {
        return (hour - baseHour) * hourHeight + minute * hourHeight / 60.0;
    }

    public double heightOf(long durationMinutes) {
        return Math.max(minEventHeight, durationMinutes * hourHeight / 60.0);
    }
}
