package com.dayplanner.service;

import java.time.LocalTime;

public record CurrentTimeIndicator(double verticalOffset, LocalTime time) {
}
