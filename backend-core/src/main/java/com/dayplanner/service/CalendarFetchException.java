package com.dayplanner.service;

public class CalendarFetchException extends RuntimeException {

    public CalendarFetchException(String message) {
        super(message);
    }

    public CalendarFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
