package com.dayplanner.domain.enums;

import java.util.Locale;
import java.util.Optional;

public enum AccountKind {
    PERSONAL,
    PROFESSIONAL;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AccountKind> fromKey(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (AccountKind kind : values()) {
            if (kind.key().equalsIgnoreCase(value.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
