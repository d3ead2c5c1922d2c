package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;

public record TimelineEvent(CalendarEvent event, AccountKind account) {

    public boolean isPersonal() {
        return account == AccountKind.PERSONAL;
    }
}
