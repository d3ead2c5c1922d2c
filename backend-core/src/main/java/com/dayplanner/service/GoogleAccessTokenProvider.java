package com.dayplanner.service;

import com.dayplanner.config.GoogleCalendarProperties;
import com.dayplanner.domain.enums.AccountKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Service
public class GoogleAccessTokenProvider implements AccessTokenProvider {

    private static final long EXPIRY_MARGIN_SEC = 30;

    private final GoogleCalendarProperties properties;
    private final RestClient tokenClient;
    private final Clock clock;

    private final Map<AccountKind, CachedToken> tokens = new EnumMap<>(AccountKind.class);

    @Autowired
    public GoogleAccessTokenProvider(GoogleCalendarProperties properties,
                                     RestClient.Builder restClientBuilder,
                                     Clock clock) {
        this.properties = properties;
        this.tokenClient = restClientBuilder.baseUrl(properties.safeTokenUri()).build();
        this.clock = clock;
    }

    @Override
    public boolean isLinked(AccountKind account) {
        return properties.isAccountConfigured(account);
    }

    @Override
    public synchronized String accessToken(AccountKind account) {
        if (!isLinked(account)) {
            throw new CalendarAuthException("No access token available");
        }

        long now = clock.instant().getEpochSecond();
        CachedToken cached = tokens.get(account);
        if (cached != null && cached.expiresAtEpochSec() - now > EXPIRY_MARGIN_SEC) {
            return cached.value();
        }

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", properties.clientId());
        body.add("client_secret", properties.clientSecret());
        body.add("refresh_token", properties.refreshToken(account));
        body.add("grant_type", "refresh_token");

        try {
            Map<?, ?> tokenResp = tokenClient.post()
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(body)
                    .retrieve()
                    .body(Map.class);
            if (tokenResp == null || !(tokenResp.get("access_token") instanceof String token)) {
                throw new CalendarAuthException("Failed to authenticate with Google Calendar");
            }
            Number expiresIn = tokenResp.get("expires_in") instanceof Number n ? n : 3600;
            tokens.put(account, new CachedToken(token, now + expiresIn.longValue()));
            log.info("Refreshed Google access token for account={}, expiresIn={}s", account.key(), expiresIn);
            return token;
        } catch (RestClientException e) {
            throw new CalendarAuthException("Google OAuth token refresh failed: " + e.getMessage(), e);
        }
    }

    private record CachedToken(String value, long expiresAtEpochSec) {
    }
}
