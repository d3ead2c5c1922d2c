package com.dayplanner.service;

public class CalendarAuthException extends CalendarFetchException {

    public CalendarAuthException(String message) {
        super(message);
    }

    public CalendarAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
