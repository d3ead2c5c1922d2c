package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

public record CacheKey(AccountKind account, LocalDate rangeStart, LocalDate rangeEnd) {

    public static CacheKey of(AccountKind account, DateRange range) {
        return new CacheKey(account, range.start(), range.end());
    }

    public String value() {
        return account.key()
                + "_" + rangeStart.format(DateTimeFormatter.ISO_LOCAL_DATE)
                + "_" + rangeEnd.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    @Override
    public String toString() {
        return value();
    }
}
