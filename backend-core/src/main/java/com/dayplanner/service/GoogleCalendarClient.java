package com.dayplanner.service;

import com.dayplanner.config.GoogleCalendarProperties;
import com.dayplanner.domain.enums.AccountKind;
import com.dayplanner.util.CalendarDays;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@Service
public class GoogleCalendarClient implements RemoteCalendarClient {

    private static final int MAX_RESULTS = 2500;
    private static final String UNTITLED = "(No title)";

    private final RestClient calendarRestClient;
    private final AccessTokenProvider accessTokenProvider;
    private final ObjectMapper objectMapper;
    private final ZoneId zoneId;

    @Autowired
    public GoogleCalendarClient(GoogleCalendarProperties properties,
                                AccessTokenProvider accessTokenProvider,
                                RestClient.Builder restClientBuilder,
                                ObjectMapper objectMapper) {
        this.calendarRestClient = restClientBuilder.baseUrl(properties.safeApiBase()).build();
        this.accessTokenProvider = accessTokenProvider;
        this.objectMapper = objectMapper;
        this.zoneId = properties.safeZoneId();
    }

    @Override
    public List<CalendarSource> fetchCalendars(AccountKind account) {
        String accessToken = accessTokenProvider.accessToken(account);
        Map<?, ?> response = execute(() -> calendarRestClient.get()
                .uri("/users/me/calendarList")
                .header("Authorization", "Bearer " + accessToken)
                .retrieve()
                .body(Map.class));

        List<CalendarSource> calendars = parseCalendars(objectMapper.valueToTree(response));
        log.debug("Fetched {} calendars for account={}", calendars.size(), account.key());
        return calendars;
    }

    @Override
    public List<CalendarEvent> fetchEvents(AccountKind account, DateRange range, List<CalendarSource> calendars) {
        if (calendars.isEmpty()) {
            return List.of();
        }
        String accessToken = accessTokenProvider.accessToken(account);
        String timeMin = range.timeMin(zoneId).toString();
        String timeMax = range.timeMax(zoneId).toString();

        List<CalendarEvent> events = new ArrayList<>();
        for (CalendarSource calendar : calendars) {
            try {
                Map<?, ?> response = execute(() -> calendarRestClient.get()
                        .uri(uri -> uri
                                .path("/calendars/{calendarId}/events")
                                .queryParam("timeMin", timeMin)
                                .queryParam("timeMax", timeMax)
                                .queryParam("singleEvents", true)
                                .queryParam("orderBy", "startTime")
                                .queryParam("maxResults", MAX_RESULTS)
                                .build(calendar.id()))
                        .header("Authorization", "Bearer " + accessToken)
                        .retrieve()
                        .body(Map.class));
                for (CalendarEvent event : parseEvents(objectMapper.valueToTree(response))) {
                    events.add(event.withSourceCalendarId(calendar.id()));
                }
            } catch (CalendarAuthException e) {
                throw e;
            } catch (CalendarFetchException e) {
                log.warn("Failed to fetch events of calendar {} for account={}: {}",
                        calendar.id(), account.key(), e.getMessage());
            }
        }

        events.sort(CalendarDays.chronological(zoneId));
        log.debug("Fetched {} events for account={} range={}..{}", events.size(), account.key(), range.start(), range.end());
        return List.copyOf(events);
    }

    List<CalendarSource> parseCalendars(JsonNode root) {
        List<CalendarSource> calendars = new ArrayList<>();
        for (JsonNode item : items(root)) {
            String id = textOr(item, "id", null);
            if (id == null) {
                continue;
            }
            JsonNode primary = item.get("primary");
            calendars.add(new CalendarSource(
                    id,
                    textOr(item, "summary", id),
                    textOr(item, "foregroundColor", null),
                    textOr(item, "backgroundColor", null),
                    primary == null || primary.isNull() ? null : primary.asBoolean()
            ));
        }
        return calendars;
    }

    List<CalendarEvent> parseEvents(JsonNode root) {
        List<CalendarEvent> events = new ArrayList<>();
        for (JsonNode item : items(root)) {
            String id = textOr(item, "id", null);
            if (id == null) {
                continue;
            }
            List<String> recurrence = new ArrayList<>();
            JsonNode rules = item.get("recurrence");
            if (rules != null && rules.isArray()) {
                rules.forEach(rule -> recurrence.add(rule.asText()));
            }
            events.add(new CalendarEvent(
                    id,
                    textOr(item, "summary", UNTITLED),
                    textOr(item, "description", null),
                    textOr(item, "location", null),
                    parseDateNode(item.path("start")),
                    parseDateNode(item.path("end")),
                    null,
                    textOr(item, "recurringEventId", null),
                    recurrence
            ));
        }
        return events;
    }

    private EventDateTime parseDateNode(JsonNode node) {
        String timeZone = textOr(node, "timeZone", null);

        String date = textOr(node, "date", null);
        if (date != null) {
            try {
                return EventDateTime.ofDate(LocalDate.parse(date));
            } catch (DateTimeParseException e) {
                log.debug("Unparseable event date '{}': {}", date, e.getMessage());
            }
        }

        String dateTime = textOr(node, "dateTime", null);
        if (dateTime != null) {
            try {
                return EventDateTime.ofInstant(OffsetDateTime.parse(dateTime).toInstant(), timeZone);
            } catch (DateTimeParseException e) {
                log.debug("Unparseable event dateTime '{}': {}", dateTime, e.getMessage());
            }
        }

        return new EventDateTime(null, null, timeZone);
    }

    private <T> T execute(Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                throw new CalendarAuthException("Access denied to Google Calendar", e);
            }
            throw new CalendarApiException(status);
        } catch (ResourceAccessException e) {
            throw new CalendarNetworkException(e.getCause() == null ? e : e.getCause());
        } catch (RestClientException e) {
            throw new CalendarFetchException("Invalid response from Google Calendar API", e);
        }
    }

    private Iterable<JsonNode> items(JsonNode root) {
        if (root == null || root.isNull()) {
            return List.of();
        }
        JsonNode items = root.get("items");
        if (items == null || !items.isArray()) {
            return List.of();
        }
        return items;
    }

    private String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? fallback : text;
    }
}
