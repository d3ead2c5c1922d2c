package com.dayplanner.config;

import com.dayplanner.domain.enums.AccountKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "app.google.calendar")
public record GoogleCalendarProperties(
        boolean enabled,
        String clientId,
        String clientSecret,
        String personalRefreshToken,
        String professionalRefreshToken,
        String tokenUri,
        String apiBase,
        String zoneId
) {
    public boolean isOAuthConfigured() {
        return enabled
                && notBlank(clientId)
                && notBlank(clientSecret);
    }

    public boolean isAccountConfigured(AccountKind account) {
        return isOAuthConfigured() && notBlank(refreshToken(account));
    }

    public String refreshToken(AccountKind account) {
        return switch (account) {
            case PERSONAL -> personalRefreshToken;
            case PROFESSIONAL -> professionalRefreshToken;
        };
    }

    public String safeTokenUri() {
        return notBlank(tokenUri) ? tokenUri : "https://oauth2.googleapis.com/token";
    }

    public String safeApiBase() {
        return notBlank(apiBase) ? apiBase : "https://www.googleapis.com/calendar/v3";
    }

    public ZoneId safeZoneId() {
        if (!notBlank(zoneId)) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            return ZoneId.systemDefault();
        }
    }

    private boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
