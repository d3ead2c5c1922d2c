package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;
import com.dayplanner.support.FakeClock;
import com.dayplanner.support.TestEvents;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimelineLayoutEngineTest {

    private static final LocalDate DAY = LocalDate.of(2026, 10, 19);

    private final FakeClock clock = new FakeClock(Instant.parse("2026-10-19T14:30:00Z"));
    private final TimelineLayoutEngine engine = new TimelineLayoutEngine(clock);

    @Test
    void overlapping_events_share_a_cluster_and_split_the_width() {
        TimelineLayout layout = engine.layoutDay(DAY, List.of(
                personal(at("a", 9, 0, 10, 0)),
                personal(at("b", 9, 30, 10, 30)),
                personal(at("c", 11, 0, 11, 30))
        ), TimelineGeometry.of(60, 0, 200));

        Map<String, EventLayout> byId = byId(layout);
        EventLayout a = byId.get("a");
        EventLayout b = byId.get("b");
        EventLayout c = byId.get("c");

        assertThat(a.verticalOffset()).isEqualTo(540);
        assertThat(a.height()).isEqualTo(60);
        assertThat(b.verticalOffset()).isEqualTo(570);
        assertThat(b.height()).isEqualTo(60);
        assertThat(c.verticalOffset()).isEqualTo(660);
        assertThat(c.height()).isEqualTo(30);

        assertThat(a.cluster()).isEqualTo(b.cluster());
        assertThat(a.columnCount()).isEqualTo(2);
        assertThat(a.columnWidth()).isEqualTo(96);
        assertThat(a.horizontalOffset()).isEqualTo(2);
        assertThat(b.column()).isEqualTo(1);
        assertThat(b.horizontalOffset()).isEqualTo(102);

        assertThat(c.cluster()).isNotEqualTo(a.cluster());
        assertThat(c.columnCount()).isEqualTo(1);
        assertThat(c.columnWidth()).isEqualTo(196);
    }

    @Test
    void touching_events_are_not_overlapping() {
        TimelineLayout layout = engine.layoutDay(DAY, List.of(
                personal(at("first", 9, 0, 10, 0)),
                personal(at("second", 10, 0, 11, 0))
        ), TimelineGeometry.of(60, 0, 200));

        assertThat(layout.events()).extracting(EventLayout::columnCount).containsOnly(1);
        assertThat(layout.events()).extracting(EventLayout::cluster).containsExactly(0, 1);
    }

    @Test
    void greedy_clustering_keeps_a_long_event_with_everything_it_overlaps() {
        TimelineLayout layout = engine.layoutDay(DAY, List.of(
                personal(at("long", 9, 0, 12, 0)),
                personal(at("early", 9, 30, 10, 0)),
                personal(at("late", 10, 30, 11, 0))
        ), TimelineGeometry.of(60, 0, 300));

        assertThat(layout.events()).hasSize(3);
        assertThat(layout.events()).extracting(EventLayout::cluster).containsOnly(0);
        assertThat(layout.events()).extracting(EventLayout::columnCount).containsOnly(3);
        assertThat(layout.events()).extracting(EventLayout::column).containsExactly(0, 1, 2);
        assertThat(layout.events()).extracting(EventLayout::columnWidth).containsOnly(96.0);
    }

    @Test
    void random_days_never_overlap_across_clusters_and_conserve_width() {
        double width = 300;
        for (long seed = 1; seed <= 25; seed++) {
            Random random = new Random(seed);
            List<TimelineEvent> events = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                int startMinute = random.nextInt(22 * 60);
                int duration = 15 + random.nextInt(180);
                LocalDateTime start = DAY.atStartOfDay().plusMinutes(startMinute);
                events.add(personal(TestEvents.timed("e" + i, start, start.plusMinutes(duration))));
            }

            TimelineLayout layout = engine.layoutDay(DAY, events, TimelineGeometry.of(60, 0, width));
            List<EventLayout> laidOut = layout.events();
            assertThat(laidOut).hasSize(events.size());

            for (EventLayout first : laidOut) {
                for (EventLayout second : laidOut) {
                    if (first.cluster() != second.cluster()) {
                        assertThat(intersects(first.event(), second.event()))
                                .as("seed %d: %s and %s", seed, first.event().id(), second.event().id())
                                .isFalse();
                    }
                }
            }

            Map<Integer, List<EventLayout>> clusters = laidOut.stream()
                    .collect(Collectors.groupingBy(EventLayout::cluster));
            for (List<EventLayout> cluster : clusters.values()) {
                int columns = cluster.get(0).columnCount();
                assertThat(cluster).hasSize(columns);
                double bands = cluster.stream().mapToDouble(e -> e.columnWidth() + 4).sum();
                assertThat(bands).isCloseTo(width, within(1e-9));
            }
        }
    }

    @Test
    void short_events_get_the_minimum_height() {
        TimelineLayout layout = engine.layoutDay(DAY, List.of(personal(at("ping", 8, 0, 8, 5))),
                TimelineGeometry.of(60, 0, 200));

        assertThat(layout.events().get(0).height()).isEqualTo(20);
    }

    @Test
    void offsets_are_measured_from_the_base_hour_and_earlier_events_are_dropped() {
        TimelineLayout layout = engine.layoutDay(DAY, List.of(
                personal(at("breakfast", 7, 0, 7, 45)),
                personal(at("standup", 8, 30, 9, 0))
        ), TimelineGeometry.of(120, 8, 200));

        assertThat(layout.events()).hasSize(1);
        EventLayout standup = layout.events().get(0);
        assertThat(standup.event().id()).isEqualTo("standup");
        assertThat(standup.verticalOffset()).isEqualTo(60);
        assertThat(standup.height()).isEqualTo(60);
    }

    @Test
    void events_from_the_previous_day_are_clipped_to_midnight() {
        CalendarEvent overnight = TestEvents.timed("overnight",
                DAY.minusDays(1).atTime(22, 0), DAY.atTime(2, 0));

        TimelineLayout layout = engine.layoutDay(DAY, List.of(personal(overnight)), TimelineGeometry.of(60, 0, 200));

        assertThat(layout.events()).hasSize(1);
        assertThat(layout.events().get(0).verticalOffset()).isEqualTo(0);
        assertThat(layout.events().get(0).height()).isEqualTo(120);
    }

    @Test
    void event_ending_at_midnight_is_not_laid_out_on_the_next_day() {
        CalendarEvent lateShow = TestEvents.timed("late-show", DAY.minusDays(1).atTime(22, 0), DAY.atStartOfDay());

        TimelineLayout layout = engine.layoutDay(DAY, List.of(personal(lateShow)), TimelineGeometry.of(60, 0, 200));

        assertThat(layout.events()).isEmpty();
    }

    @Test
    void account_is_carried_into_the_layout() {
        TimelineLayout layout = engine.layoutDay(DAY, List.of(
                new TimelineEvent(at("gym", 7, 0, 8, 0), AccountKind.PERSONAL),
                new TimelineEvent(at("review", 10, 0, 11, 0), AccountKind.PROFESSIONAL)
        ), TimelineGeometry.of(60, 0, 200));

        Map<String, EventLayout> byId = byId(layout);
        assertThat(byId.get("gym").personal()).isTrue();
        assertThat(byId.get("review").personal()).isFalse();
    }

    @Test
    void all_day_block_is_empty_without_all_day_events() {
        TimelineLayout layout = engine.layoutDay(DAY, List.of(personal(at("a", 9, 0, 10, 0))),
                TimelineGeometry.of(60, 0, 200));

        assertThat(layout.allDay().rows()).isEmpty();
        assertThat(layout.allDay().blockHeight()).isEqualTo(0);
    }

    @Test
    void all_day_rows_are_stacked_at_full_width() {
        TimelineLayout layout = engine.layoutDay(DAY, List.of(
                personal(TestEvents.allDay("holiday", DAY, DAY.plusDays(1))),
                personal(TestEvents.allDay("trip", DAY.minusDays(1), DAY.plusDays(2))),
                personal(at("a", 9, 0, 10, 0))
        ), TimelineGeometry.of(60, 0, 200));

        AllDayLayout allDay = layout.allDay();
        assertThat(allDay.rows()).hasSize(2);
        assertThat(allDay.blockHeight()).isEqualTo(48);
        assertThat(allDay.rows()).extracting(AllDayLayout.AllDayRow::verticalOffset).containsExactly(0.0, 24.0);
        assertThat(allDay.rows()).extracting(AllDayLayout.AllDayRow::width).containsOnly(200.0);
        assertThat(layout.events()).hasSize(1);
    }

    @Test
    void single_all_day_event_uses_the_minimum_block_height() {
        TimelineGeometry tight = new TimelineGeometry(60, 0, 24, 200, 20, 4, 10, 2, true);

        TimelineLayout layout = engine.layoutDay(DAY,
                List.of(personal(TestEvents.allDay("holiday", DAY, DAY.plusDays(1)))), tight);

        assertThat(layout.allDay().blockHeight()).isEqualTo(20);
    }

    @Test
    void current_time_indicator_is_shown_only_for_today() {
        TimelineGeometry geometry = TimelineGeometry.of(60, 0, 200);

        TimelineLayout today = engine.layoutDay(DAY, List.of(), geometry);
        TimelineLayout tomorrow = engine.layoutDay(DAY.plusDays(1), List.of(), geometry);

        assertThat(today.hasCurrentTime()).isTrue();
        assertThat(today.currentTime().verticalOffset()).isEqualTo(870);
        assertThat(today.currentTime().time()).isEqualTo(LocalTime.of(14, 30));
        assertThat(tomorrow.hasCurrentTime()).isFalse();
    }

    @Test
    void current_time_indicator_respects_the_hour_window_when_clipped() {
        TimelineGeometry clipped = new TimelineGeometry(60, 16, 22, 200, 20, 4, 20, 4, true);
        TimelineGeometry unclipped = new TimelineGeometry(60, 16, 22, 200, 20, 4, 20, 4, false);

        assertThat(engine.layoutDay(DAY, List.of(), clipped).hasCurrentTime()).isFalse();
        assertThat(engine.layoutDay(DAY, List.of(), unclipped).currentTime().verticalOffset()).isEqualTo(-90);
    }

    private static boolean intersects(CalendarEvent a, CalendarEvent b) {
        Instant aStart = a.start().dateTime();
        Instant aEnd = a.end().dateTime();
        Instant bStart = b.start().dateTime();
        Instant bEnd = b.end().dateTime();
        return aStart.isBefore(bEnd) && bStart.isBefore(aEnd);
    }

    private static Map<String, EventLayout> byId(TimelineLayout layout) {
        return layout.events().stream().collect(Collectors.toMap(e -> e.event().id(), e -> e));
    }

    private static CalendarEvent at(String id, int startHour, int startMinute, int endHour, int endMinute) {
        return TestEvents.timed(id, DAY.atTime(startHour, startMinute), DAY.atTime(endHour, endMinute));
    }

    private static TimelineEvent personal(CalendarEvent event) {
        return new TimelineEvent(event, AccountKind.PERSONAL);
    }
}
