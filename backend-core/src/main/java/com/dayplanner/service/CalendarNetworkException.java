package com.dayplanner.service;

public class CalendarNetworkException extends CalendarFetchException {

    public CalendarNetworkException(Throwable cause) {
        super("Network error: " + (cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage()), cause);
    }
}
