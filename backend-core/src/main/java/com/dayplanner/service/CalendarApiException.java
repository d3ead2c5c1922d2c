package com.dayplanner.service;

import lombok.Getter;

@Getter
public class CalendarApiException extends CalendarFetchException {

    private final int statusCode;

    public CalendarApiException(int statusCode) {
        super("Google Calendar API error: " + statusCode);
        this.statusCode = statusCode;
    }
}
